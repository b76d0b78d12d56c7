package dev.logicojp.reviewthreads.service;

import dev.logicojp.reviewthreads.cascade.PatchOperation;
import dev.logicojp.reviewthreads.cascade.StatusCascade;
import dev.logicojp.reviewthreads.config.AzureDevOpsConfig;
import dev.logicojp.reviewthreads.devops.CreatedThread;
import dev.logicojp.reviewthreads.devops.PullRequestRef;
import dev.logicojp.reviewthreads.devops.ThreadAnchor;
import dev.logicojp.reviewthreads.devops.ThreadClient;
import dev.logicojp.reviewthreads.devops.ThreadStatus;
import dev.logicojp.reviewthreads.state.FileEntry;
import dev.logicojp.reviewthreads.state.ReviewPaths;
import dev.logicojp.reviewthreads.state.ReviewState;
import dev.logicojp.reviewthreads.state.ReviewStateNotFoundException;
import dev.logicojp.reviewthreads.state.ReviewStateOperations;
import dev.logicojp.reviewthreads.state.ReviewStateStore;
import dev.logicojp.reviewthreads.state.ReviewStatus;
import dev.logicojp.reviewthreads.state.Severity;
import dev.logicojp.reviewthreads.state.SuggestionEntry;
import dev.logicojp.reviewthreads.template.ReviewTemplateRenderer;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Drives the review of a single file and keeps the summary threads in sync.
 *
 * <p>Each step loads the state, mutates it, pushes the file summary and the
 * cascaded folder/overall summaries to the discussion API and saves the state
 * again. The save also happens when an API call fails half way, so the state
 * reflects what the reviewer did. Dry runs never write the state.</p>
 */
@Singleton
public class FileReviewService {

    private static final Logger logger = LoggerFactory.getLogger(FileReviewService.class);

    private final ReviewStateStore store;
    private final ThreadClient threadClient;
    private final AzureDevOpsConfig devOpsConfig;

    @Inject
    public FileReviewService(ReviewStateStore store, ThreadClient threadClient, AzureDevOpsConfig devOpsConfig) {
        this.store = store;
        this.threadClient = threadClient;
        this.devOpsConfig = devOpsConfig;
    }

    /**
     * Marks an unreviewed file as in progress.
     * <p>No-op when the PR was not scaffolded, the file is not tracked or its
     * review already started.</p>
     * @return {@code true} if the file moved to in-progress
     */
    public boolean startFileReview(long prId, String filePath, boolean dryRun) throws IOException {
        ReviewState state;
        try {
            state = store.load(prId);
        } catch (ReviewStateNotFoundException e) {
            logger.info("No review state for PR {}; not tracking {}", prId, filePath);
            return false;
        }
        Optional<FileEntry> entry = ReviewStateOperations.getFileEntry(state, filePath);
        if (entry.isEmpty()) {
            logger.info("{} is not tracked for PR {}", filePath, prId);
            return false;
        }
        if (entry.get().getStatus() != ReviewStatus.UNREVIEWED) {
            logger.debug("{} is already {}; nothing to start", filePath, entry.get().getStatus());
            return false;
        }

        ReviewStateOperations.updateFileStatus(state, filePath, ReviewStatus.IN_PROGRESS);
        runAndPersist(state, dryRun, () -> {
            PullRequestRef pullRequest = pullRequestOf(state);
            patchFileComment(state, filePath, pullRequest, dryRun);
            cascade(state, filePath, pullRequest, dryRun);
        });
        logger.info("Started review of {} in PR {}", filePath, prId);
        return true;
    }

    /**
     * Re-opens a reviewed file for another round.
     * <p>The current suggestions are rotated into {@code previousSuggestions},
     * the file goes back to in-progress and its thread is re-activated.</p>
     * @return {@code true} if the file was re-opened, {@code false} if it was not in a terminal status
     * @throws ReviewStateNotFoundException if the PR was not scaffolded
     */
    public boolean reopenFileReview(long prId, String filePath, boolean dryRun) throws IOException {
        ReviewState state = store.load(prId);
        FileEntry entry = ReviewStateOperations.requireFileEntry(state, filePath);
        if (!entry.getStatus().isTerminal()) {
            logger.info("{} is {}; only reviewed files can be re-opened", filePath, entry.getStatus());
            return false;
        }

        ReviewStateOperations.clearSuggestionsForReReview(state, filePath);
        ReviewStateOperations.updateFileStatus(state, filePath, ReviewStatus.IN_PROGRESS);
        runAndPersist(state, dryRun, () -> {
            PullRequestRef pullRequest = pullRequestOf(state);
            patchFileComment(state, filePath, pullRequest, dryRun);
            threadClient.patchThreadStatus(pullRequest, entry.getThreadId(),
                StatusCascade.threadStatusFor(ReviewStatus.IN_PROGRESS), dryRun);
            cascade(state, filePath, pullRequest, dryRun);
        });
        logger.info("Re-opened review of {} in PR {}", filePath, prId);
        return true;
    }

    /**
     * Posts a line-anchored suggestion thread and records it on the file.
     * @param endLine last line of the range; values below {@code line} fall back to {@code line}
     * @return the recorded suggestion; empty for a dry run
     * @throws ReviewStateNotFoundException if the PR was not scaffolded
     */
    public Optional<SuggestionEntry> postSuggestion(long prId, String filePath, int line, int endLine,
                                                    Severity severity, boolean outOfScope,
                                                    String linkText, String content,
                                                    boolean dryRun) throws IOException {
        Objects.requireNonNull(severity, "severity");
        if (line <= 0) {
            throw new IllegalArgumentException("line must be positive: " + line);
        }
        int lastLine = Math.max(line, endLine);

        ReviewState state = store.load(prId);
        ReviewStateOperations.requireFileEntry(state, filePath);
        String path = ReviewPaths.normalize(filePath);

        if (dryRun) {
            logger.info("[DRY RUN] Would create {} suggestion thread on {} lines {}-{}",
                severity.label(), path, line, lastLine);
            return Optional.empty();
        }

        CreatedThread thread = threadClient.createThread(pullRequestOf(state), content,
            ThreadAnchor.lines(path, line, lastLine));
        SuggestionEntry suggestion = new SuggestionEntry(thread.threadId(), thread.commentId(),
            line, lastLine, severity, outOfScope, linkText, content);
        ReviewStateOperations.addSuggestionToFile(state, path, suggestion);
        store.save(state);
        logger.info("Recorded {} suggestion on {} (thread {})", severity.label(), path, thread.threadId());
        return Optional.of(suggestion);
    }

    /**
     * Finishes the review of a file.
     * <p>Approving also closes the suggestion threads recorded on the file.</p>
     * @param status {@code approved} or {@code needs-work}
     * @throws IllegalArgumentException if the status is not terminal
     * @throws ReviewStateNotFoundException if the PR was not scaffolded
     */
    public ReviewState completeFileReview(long prId, String filePath, ReviewStatus status, String summary,
                                          boolean dryRun) throws IOException {
        Objects.requireNonNull(status, "status");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException(
                "A review can only complete as approved or needs-work, got: " + status.value());
        }
        ReviewState state = store.load(prId);
        FileEntry entry = ReviewStateOperations.requireFileEntry(state, filePath);

        ReviewStateOperations.updateFileStatus(state, filePath, status, summary, null);
        runAndPersist(state, dryRun, () -> {
            PullRequestRef pullRequest = pullRequestOf(state);
            patchFileComment(state, filePath, pullRequest, dryRun);
            threadClient.patchThreadStatus(pullRequest, entry.getThreadId(),
                StatusCascade.threadStatusFor(status), dryRun);
            if (status == ReviewStatus.APPROVED) {
                closeSuggestionThreads(entry, filePath, pullRequest, dryRun);
            }
            cascade(state, filePath, pullRequest, dryRun);
        });
        logger.info("Completed review of {} in PR {} as {}", filePath, prId, status.value());
        return state;
    }

    private void patchFileComment(ReviewState state, String filePath, PullRequestRef pullRequest,
                                  boolean dryRun) {
        FileEntry entry = ReviewStateOperations.requireFileEntry(state, filePath);
        String content = ReviewTemplateRenderer.renderFileSummary(
            ReviewPaths.normalize(filePath), entry, baseUrl(state));
        threadClient.patchComment(pullRequest, entry.getThreadId(), entry.getCommentId(), content, dryRun);
    }

    private void closeSuggestionThreads(FileEntry entry, String filePath, PullRequestRef pullRequest,
                                        boolean dryRun) {
        for (SuggestionEntry suggestion : entry.getSuggestions()) {
            logger.info("Closing suggestion thread {} on {}", suggestion.threadId(), filePath);
            threadClient.patchThreadStatus(pullRequest, suggestion.threadId(), ThreadStatus.CLOSED, dryRun);
        }
    }

    private void cascade(ReviewState state, String filePath, PullRequestRef pullRequest, boolean dryRun) {
        List<PatchOperation> operations = StatusCascade.cascadeStatusUpdate(state, filePath, baseUrl(state));
        StatusCascade.executeCascade(operations, threadClient, pullRequest, dryRun);
    }

    /// Runs the API calls and saves the state, also when a call fails.
    /// A failing save is attached to the API failure as suppressed.
    private void runAndPersist(ReviewState state, boolean dryRun, Runnable apiCalls) throws IOException {
        if (dryRun) {
            apiCalls.run();
            return;
        }
        try {
            apiCalls.run();
        } catch (RuntimeException e) {
            try {
                store.save(state);
            } catch (IOException saveFailure) {
                e.addSuppressed(saveFailure);
            }
            throw e;
        }
        store.save(state);
    }

    private PullRequestRef pullRequestOf(ReviewState state) {
        return new PullRequestRef(state.getRepoId(), state.getPrId());
    }

    private String baseUrl(ReviewState state) {
        return devOpsConfig.pullRequestUrl(state.getPrId());
    }
}
