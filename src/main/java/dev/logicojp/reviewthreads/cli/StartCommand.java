package dev.logicojp.reviewthreads.cli;

import dev.logicojp.reviewthreads.service.FileReviewService;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;

@Command(
    name = "start",
    description = "Mark an unreviewed file as in progress and refresh its summaries."
)
public class StartCommand extends AbstractReviewCommand {

    @Inject
    FileReviewService reviewService;

    @Option(names = {"--pr"}, description = "Pull request id", required = true)
    long prId;

    @Option(names = {"--file"}, description = "File path", required = true)
    String filePath;

    @Option(names = {"--dry-run"}, description = "Log API calls instead of sending them")
    boolean dryRun;

    @Override
    protected int execute() throws IOException {
        if (reviewService.startFileReview(prId, filePath, dryRun)) {
            out.println("Review started: " + filePath);
        } else {
            out.println("Nothing to start for " + filePath);
        }
        return ExitCodes.OK;
    }
}
