package dev.logicojp.reviewthreads.cli;

import dev.logicojp.reviewthreads.scaffold.ScaffoldRequest;
import dev.logicojp.reviewthreads.scaffold.ThreadScaffolder;
import dev.logicojp.reviewthreads.state.ReviewState;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Creates the file, folder and overall summary threads of a pull request.
 */
@Command(
    name = "scaffold",
    description = "Create all review summary threads for a pull request."
)
public class ScaffoldCommand extends AbstractReviewCommand {

    @Inject
    ThreadScaffolder scaffolder;

    @Option(names = {"--pr"}, description = "Pull request id", required = true)
    long prId;

    @Option(names = {"--repo-id"}, description = "Repository id (GUID)", required = true)
    String repoId;

    @Option(names = {"--repo-name"}, description = "Repository name", required = true)
    String repoName;

    @Option(names = {"--iteration"}, description = "Latest PR iteration id (default: 1)", defaultValue = "1")
    long iterationId;

    @Option(names = {"--file"}, description = "Changed file path. Can be specified multiple times.")
    List<String> files;

    @Option(names = {"--files-from"}, description = "Text file listing one changed path per line")
    Path filesFrom;

    @Option(names = {"--dry-run"}, description = "Print the plan without calling the API")
    boolean dryRun;

    @Override
    protected int execute() throws IOException {
        List<String> changedFiles = collectFiles();
        if (changedFiles.isEmpty()) {
            throw new CliValidationException("At least one --file or a non-empty --files-from is required.", true);
        }
        Optional<ReviewState> state = scaffolder.scaffold(
            new ScaffoldRequest(prId, repoId, repoName, iterationId, changedFiles), dryRun);
        state.ifPresent(s -> out.println("Tracking %d file(s) in %d folder(s)."
            .formatted(s.getFiles().size(), s.getFolders().size())));
        return ExitCodes.OK;
    }

    private List<String> collectFiles() throws IOException {
        List<String> result = new ArrayList<>();
        if (files != null) {
            result.addAll(files);
        }
        if (filesFrom != null) {
            if (!Files.isRegularFile(filesFrom)) {
                throw new CliValidationException("File list not found: " + filesFrom, false);
            }
            for (String line : Files.readAllLines(filesFrom, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    result.add(line.trim());
                }
            }
        }
        return result;
    }
}
