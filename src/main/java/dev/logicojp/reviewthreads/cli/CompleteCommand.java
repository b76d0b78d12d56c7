package dev.logicojp.reviewthreads.cli;

import dev.logicojp.reviewthreads.service.FileReviewService;
import dev.logicojp.reviewthreads.state.ReviewState;
import dev.logicojp.reviewthreads.state.ReviewStatus;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;

@Command(
    name = "complete",
    description = "Finish a file review as approved or needs-work and cascade the result."
)
public class CompleteCommand extends AbstractReviewCommand {

    @Inject
    FileReviewService reviewService;

    @Option(names = {"--pr"}, description = "Pull request id", required = true)
    long prId;

    @Option(names = {"--file"}, description = "File path", required = true)
    String filePath;

    @Option(names = {"--status"}, description = "approved or needs-work", required = true)
    String status;

    @Option(names = {"--summary"}, description = "Summary of the changes in the file", required = true)
    String summary;

    @Option(names = {"--dry-run"}, description = "Log API calls instead of sending them")
    boolean dryRun;

    @Override
    protected int execute() throws IOException {
        ReviewStatus reviewStatus = parseStatus(status);
        if (!reviewStatus.isTerminal()) {
            throw new CliValidationException("--status must be approved or needs-work", true);
        }
        ReviewState state = reviewService.completeFileReview(prId, filePath, reviewStatus, summary, dryRun);
        out.println("%s: %s (overall: %s)".formatted(filePath, reviewStatus.displayName(),
            state.getOverallSummary().getStatus().displayName()));
        return ExitCodes.OK;
    }
}
