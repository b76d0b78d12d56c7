package dev.logicojp.reviewthreads.cascade;

import dev.logicojp.reviewthreads.devops.PullRequestRef;
import dev.logicojp.reviewthreads.devops.ThreadClient;
import dev.logicojp.reviewthreads.devops.ThreadStatus;
import dev.logicojp.reviewthreads.state.FileEntry;
import dev.logicojp.reviewthreads.state.FolderEntry;
import dev.logicojp.reviewthreads.state.ReviewState;
import dev.logicojp.reviewthreads.state.ReviewStateOperations;
import dev.logicojp.reviewthreads.state.ReviewStatus;
import dev.logicojp.reviewthreads.template.ReviewTemplateRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/// Propagates a file status change to its folder and to the pull request summary.
///
/// {@link #cascadeStatusUpdate} only touches memory; {@link #executeCascade}
/// performs the resulting thread API calls in order.
public final class StatusCascade {

    private static final Logger logger = LoggerFactory.getLogger(StatusCascade.class);

    private static final Map<ReviewStatus, ThreadStatus> THREAD_STATUS = threadStatusTable();

    private StatusCascade() {
    }

    private static Map<ReviewStatus, ThreadStatus> threadStatusTable() {
        Map<ReviewStatus, ThreadStatus> table = new EnumMap<>(ReviewStatus.class);
        table.put(ReviewStatus.UNREVIEWED, ThreadStatus.ACTIVE);
        table.put(ReviewStatus.IN_PROGRESS, ThreadStatus.ACTIVE);
        table.put(ReviewStatus.APPROVED, ThreadStatus.CLOSED);
        table.put(ReviewStatus.NEEDS_WORK, ThreadStatus.ACTIVE);
        return Collections.unmodifiableMap(table);
    }

    /// Thread status that mirrors a review status: only `approved` closes a thread.
    public static ThreadStatus threadStatusFor(ReviewStatus status) {
        return THREAD_STATUS.get(status);
    }

    /// Re-derives the folder and overall statuses after `filePath` changed and
    /// returns the two updates to apply, folder first, then overall.
    ///
    /// The state is updated in place with the derived statuses.
    /// @throws dev.logicojp.reviewthreads.state.ReviewEntryNotFoundException if the file or its folder is unknown
    public static List<PatchOperation> cascadeStatusUpdate(ReviewState state, String filePath, String baseUrl) {
        FileEntry file = ReviewStateOperations.requireFileEntry(state, filePath);
        String folderName = file.getFolder();
        FolderEntry folder = ReviewStateOperations.requireFolderEntry(state, folderName);

        ReviewStatus folderStatus = StatusDerivation.deriveFolderStatus(state, folderName);
        folder.setStatus(folderStatus);
        ReviewStatus overallStatus = StatusDerivation.deriveOverallStatus(state);
        state.getOverallSummary().setStatus(overallStatus);
        logger.info("Cascade for {}: folder '{}' -> {}, overall -> {}",
            filePath, folderName, folderStatus, overallStatus);

        String folderContent = ReviewTemplateRenderer.renderFolderSummary(
            folderName, folder, state.getFiles(), baseUrl);
        String overallContent = ReviewTemplateRenderer.renderOverallSummary(state, baseUrl);

        return List.of(
            new PatchOperation(folder.getThreadId(), folder.getCommentId(),
                folderContent, threadStatusFor(folderStatus)),
            new PatchOperation(state.getOverallSummary().getThreadId(), state.getOverallSummary().getCommentId(),
                overallContent, threadStatusFor(overallStatus)));
    }

    /// Applies each operation in order: comment content first, then thread status.
    public static void executeCascade(List<PatchOperation> operations, ThreadClient client,
                                      PullRequestRef pullRequest, boolean dryRun) {
        for (PatchOperation operation : operations) {
            client.patchComment(pullRequest, operation.threadId(), operation.commentId(),
                operation.newContent(), dryRun);
            client.patchThreadStatus(pullRequest, operation.threadId(), operation.threadStatus(), dryRun);
        }
        logger.debug("Applied {} cascade operation(s) to PR {}", operations.size(), pullRequest.prId());
    }
}
