package dev.logicojp.reviewthreads.scaffold;

import dev.logicojp.reviewthreads.config.AzureDevOpsConfig;
import dev.logicojp.reviewthreads.devops.CreatedThread;
import dev.logicojp.reviewthreads.devops.PullRequestRef;
import dev.logicojp.reviewthreads.devops.ThreadAnchor;
import dev.logicojp.reviewthreads.devops.ThreadClient;
import dev.logicojp.reviewthreads.state.FileEntry;
import dev.logicojp.reviewthreads.state.FolderEntry;
import dev.logicojp.reviewthreads.state.ReviewPaths;
import dev.logicojp.reviewthreads.state.ReviewState;
import dev.logicojp.reviewthreads.state.ReviewStateNotFoundException;
import dev.logicojp.reviewthreads.state.ReviewStateStore;
import dev.logicojp.reviewthreads.template.ReviewTemplateRenderer;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Creates every summary thread of a pull request review up front.
 *
 * <p>For N files across F top-level folders this makes exactly N + F + 1
 * create calls: one file-anchored thread per file, one PR-level thread per
 * folder and one overall PR thread. The state is saved after each of the
 * three phases, so a failure loses at most the phase in progress.</p>
 *
 * <p>An existing state file for the PR means scaffolding already happened;
 * it is returned as is without any API call.</p>
 */
@Singleton
public class ThreadScaffolder {

    private static final Logger logger = LoggerFactory.getLogger(ThreadScaffolder.class);

    private final ReviewStateStore store;
    private final ThreadClient threadClient;
    private final AzureDevOpsConfig devOpsConfig;
    private final PrintStream out;
    private final Clock clock;

    @Inject
    public ThreadScaffolder(ReviewStateStore store,
                            ThreadClient threadClient,
                            AzureDevOpsConfig devOpsConfig,
                            @Named("stdout") PrintStream out) {
        this(store, threadClient, devOpsConfig, out, Clock.systemUTC());
    }

    ThreadScaffolder(ReviewStateStore store, ThreadClient threadClient, AzureDevOpsConfig devOpsConfig,
                     PrintStream out, Clock clock) {
        this.store = store;
        this.threadClient = threadClient;
        this.devOpsConfig = devOpsConfig;
        this.out = out;
        this.clock = clock;
    }

    /**
     * Scaffolds all threads for the request.
     * @param request pull request and changed files
     * @param dryRun print the plan instead of calling the API
     * @return the new or already existing state; empty only for a dry run
     *     on a PR that was not scaffolded yet
     * @throws IOException if the state cannot be read or written
     * @throws dev.logicojp.reviewthreads.devops.ThreadApiException if a thread cannot be created
     */
    public Optional<ReviewState> scaffold(ScaffoldRequest request, boolean dryRun) throws IOException {
        long prId = request.prId();
        try {
            ReviewState existing = store.load(prId);
            logger.info("Scaffolding already exists for PR {}. Skipping.", prId);
            out.println("Scaffolding already exists for PR " + prId + ". Skipping.");
            return Optional.of(existing);
        } catch (ReviewStateNotFoundException e) {
            logger.debug("No review state yet for PR {}", prId);
        }

        ScaffoldPlan plan = ScaffoldPlan.of(prId, request.files());
        if (dryRun) {
            plan.describe().forEach(out::println);
            return Optional.empty();
        }

        logger.info("Scaffolding PR {}: {} file(s), {} folder(s), {} API call(s)",
            prId, plan.files().size(), plan.folders().size(), plan.apiCallCount());

        PullRequestRef pullRequest = new PullRequestRef(request.repoId(), prId);
        String baseUrl = devOpsConfig.pullRequestUrl(prId);
        ReviewState state = new ReviewState(prId, request.repoId(), request.repoName(),
            devOpsConfig.project(), devOpsConfig.organization(), request.latestIterationId(),
            Instant.now(clock).toString());

        createFileThreads(state, plan.files(), pullRequest, baseUrl);
        checkpoint(state, "file threads");

        createFolderThreads(state, plan.folders(), pullRequest, baseUrl);
        checkpoint(state, "folder threads");

        createOverallThread(state, pullRequest, baseUrl);
        checkpoint(state, "overall thread");

        out.println("Scaffolding complete. Review state saved for PR " + prId + ".");
        return Optional.of(state);
    }

    private void createFileThreads(ReviewState state, List<String> files, PullRequestRef pullRequest,
                                   String baseUrl) {
        for (String path : files) {
            String folder = ReviewPaths.topLevelFolder(path);
            String fileName = ReviewPaths.fileName(path);
            String content = ReviewTemplateRenderer.renderFileSummary(
                path, new FileEntry(0, 0, folder, fileName), baseUrl);

            logger.info("Creating file summary thread for {}", path);
            CreatedThread thread = threadClient.createThread(pullRequest, content, ThreadAnchor.file(path));
            state.putFile(path, new FileEntry(thread.threadId(), thread.commentId(), folder, fileName));
        }
    }

    private void createFolderThreads(ReviewState state, Map<String, List<String>> folders,
                                     PullRequestRef pullRequest, String baseUrl) {
        for (Map.Entry<String, List<String>> folder : folders.entrySet()) {
            String content = ReviewTemplateRenderer.renderFolderSummary(
                folder.getKey(), new FolderEntry(0, 0, folder.getValue()), state.getFiles(), baseUrl);

            logger.info("Creating folder summary thread for {}", folder.getKey());
            CreatedThread thread = threadClient.createThread(pullRequest, content, null);
            state.putFolder(folder.getKey(),
                new FolderEntry(thread.threadId(), thread.commentId(), folder.getValue()));
        }
    }

    private void createOverallThread(ReviewState state, PullRequestRef pullRequest, String baseUrl) {
        String content = ReviewTemplateRenderer.renderOverallSummary(state, baseUrl);
        logger.info("Creating overall PR summary thread");
        CreatedThread thread = threadClient.createThread(pullRequest, content, null);
        state.getOverallSummary().assignThread(thread.threadId(), thread.commentId());
    }

    private void checkpoint(ReviewState state, String phase) throws IOException {
        store.save(state);
        logger.info("Saved review state for PR {} after {}", state.getPrId(), phase);
    }
}
