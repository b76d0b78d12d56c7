package dev.logicojp.reviewthreads.cli;

import dev.logicojp.reviewthreads.service.FileReviewService;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;

@Command(
    name = "reopen",
    description = "Re-open a reviewed file, keeping its suggestions as previous suggestions."
)
public class ReopenCommand extends AbstractReviewCommand {

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
        if (reviewService.reopenFileReview(prId, filePath, dryRun)) {
            out.println("Review re-opened: " + filePath);
        } else {
            out.println(filePath + " has not been reviewed yet; nothing to re-open");
        }
        return ExitCodes.OK;
    }
}
