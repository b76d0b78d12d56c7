package dev.logicojp.reviewthreads.state;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/// A suggestion posted as its own thread on a line range of a file.
@JsonPropertyOrder({"threadId", "commentId", "line", "endLine", "severity", "outOfScope", "linkText", "content"})
public record SuggestionEntry(
    long threadId,
    long commentId,
    int line,
    int endLine,
    Severity severity,
    boolean outOfScope,
    String linkText,
    String content
) {

    public SuggestionEntry {
        Objects.requireNonNull(severity, "severity");
        linkText = linkText == null ? "" : linkText;
        content = content == null ? "" : content;
    }
}
