package dev.logicojp.reviewthreads.cli;

import dev.logicojp.reviewthreads.service.FileReviewService;
import dev.logicojp.reviewthreads.state.Severity;
import dev.logicojp.reviewthreads.state.SuggestionEntry;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.util.Optional;

@Command(
    name = "suggest",
    description = "Post a line-anchored suggestion thread and record it on the file."
)
public class SuggestCommand extends AbstractReviewCommand {

    @Inject
    FileReviewService reviewService;

    @Option(names = {"--pr"}, description = "Pull request id", required = true)
    long prId;

    @Option(names = {"--file"}, description = "File path", required = true)
    String filePath;

    @Option(names = {"--line"}, description = "First line of the suggestion", required = true)
    int line;

    @Option(names = {"--end-line"}, description = "Last line of the suggestion (default: --line)")
    Integer endLine;

    @Option(names = {"--severity"}, description = "high, medium or low", required = true)
    String severity;

    @Option(names = {"--link-text"}, description = "Text shown in the file summary", required = true)
    String linkText;

    @Option(names = {"--content"}, description = "Suggestion comment (markdown)", required = true)
    String content;

    @Option(names = {"--out-of-scope"}, description = "Mark as outside the scope of this PR")
    boolean outOfScope;

    @Option(names = {"--dry-run"}, description = "Log the API call instead of sending it")
    boolean dryRun;

    @Override
    protected int execute() throws IOException {
        Severity parsedSeverity = parseSeverity(severity);
        int lastLine = endLine != null ? endLine : line;
        if (line <= 0 || lastLine < line) {
            throw new CliValidationException("Invalid line range: " + line + "-" + lastLine, true);
        }
        Optional<SuggestionEntry> suggestion = reviewService.postSuggestion(
            prId, filePath, line, lastLine, parsedSeverity, outOfScope, linkText, content, dryRun);
        suggestion.ifPresent(s -> out.println("Suggestion posted in thread " + s.threadId()));
        return ExitCodes.OK;
    }
}
