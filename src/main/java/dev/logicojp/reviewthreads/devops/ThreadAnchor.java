package dev.logicojp.reviewthreads.devops;

import dev.logicojp.reviewthreads.state.ReviewPaths;

import java.util.Objects;

/// File context of a thread. A thread without an anchor is a PR-level thread.
/// @param filePath repository path, normalized to a leading slash
/// @param startLine first line of the range, or {@code null} for a file-level thread
/// @param endLine last line of the range, or {@code null} for a file-level thread
public record ThreadAnchor(String filePath, Integer startLine, Integer endLine) {

    public ThreadAnchor {
        filePath = ReviewPaths.normalize(Objects.requireNonNull(filePath, "filePath"));
        if (startLine != null && endLine != null && endLine < startLine) {
            throw new IllegalArgumentException(
                "End line %d is before start line %d".formatted(endLine, startLine));
        }
    }

    /// Anchor on a whole file, without line context.
    public static ThreadAnchor file(String filePath) {
        return new ThreadAnchor(filePath, null, null);
    }

    public static ThreadAnchor lines(String filePath, int startLine, int endLine) {
        return new ThreadAnchor(filePath, startLine, endLine);
    }

    public boolean hasLines() {
        return startLine != null;
    }
}
