package dev.logicojp.reviewthreads.cli;

import dev.logicojp.reviewthreads.state.FileEntry;
import dev.logicojp.reviewthreads.state.FolderEntry;
import dev.logicojp.reviewthreads.state.ReviewState;
import dev.logicojp.reviewthreads.state.ReviewStateStore;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.util.Map;

@Command(
    name = "show",
    description = "Print the stored review statuses of a pull request."
)
public class ShowCommand extends AbstractReviewCommand {

    @Inject
    ReviewStateStore store;

    @Option(names = {"--pr"}, description = "Pull request id", required = true)
    long prId;

    @Override
    protected int execute() throws IOException {
        ReviewState state = store.load(prId);
        out.println("PR %d (%s): %s".formatted(state.getPrId(), state.getRepoName(),
            state.getOverallSummary().getStatus().displayName()));
        for (Map.Entry<String, FolderEntry> folder : state.getFolders().entrySet()) {
            out.println("  %s/: %s".formatted(folder.getKey(), folder.getValue().getStatus().displayName()));
            for (String path : folder.getValue().getFiles()) {
                FileEntry file = state.getFiles().get(path);
                if (file != null) {
                    out.println("    %s: %s (%d suggestion(s))".formatted(
                        path, file.getStatus().displayName(), file.getSuggestions().size()));
                }
            }
        }
        return ExitCodes.OK;
    }
}
