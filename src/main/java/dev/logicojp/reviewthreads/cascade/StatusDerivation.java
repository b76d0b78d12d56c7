package dev.logicojp.reviewthreads.cascade;

import dev.logicojp.reviewthreads.state.FileEntry;
import dev.logicojp.reviewthreads.state.FolderEntry;
import dev.logicojp.reviewthreads.state.ReviewState;
import dev.logicojp.reviewthreads.state.ReviewStateOperations;
import dev.logicojp.reviewthreads.state.ReviewStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/// Derives folder and overall statuses from their children.
///
/// Both levels use the same rule:
/// - no children, or all `unreviewed` → `unreviewed`
/// - some started, not all terminal → `in-progress`
/// - all terminal, any `needs-work` → `needs-work`
/// - all terminal otherwise → `approved`
public final class StatusDerivation {

    private StatusDerivation() {
    }

    /// Derives a folder status from the statuses of its tracked files.
    /// @throws dev.logicojp.reviewthreads.state.ReviewEntryNotFoundException if the folder is unknown
    public static ReviewStatus deriveFolderStatus(ReviewState state, String folderName) {
        FolderEntry folder = ReviewStateOperations.requireFolderEntry(state, folderName);
        List<ReviewStatus> fileStatuses = new ArrayList<>(folder.getFiles().size());
        for (String path : folder.getFiles()) {
            FileEntry file = state.getFiles().get(path);
            if (file != null) {
                fileStatuses.add(file.getStatus());
            }
        }
        return aggregate(fileStatuses);
    }

    /// Derives the pull request status from the current folder statuses.
    public static ReviewStatus deriveOverallStatus(ReviewState state) {
        List<ReviewStatus> folderStatuses = new ArrayList<>(state.getFolders().size());
        for (FolderEntry folder : state.getFolders().values()) {
            folderStatuses.add(folder.getStatus());
        }
        return aggregate(folderStatuses);
    }

    static ReviewStatus aggregate(Collection<ReviewStatus> children) {
        boolean anyStarted = false;
        boolean allTerminal = true;
        boolean anyNeedsWork = false;
        for (ReviewStatus status : children) {
            anyStarted |= status != ReviewStatus.UNREVIEWED;
            allTerminal &= status.isTerminal();
            anyNeedsWork |= status == ReviewStatus.NEEDS_WORK;
        }
        if (!anyStarted) {
            return ReviewStatus.UNREVIEWED;
        }
        if (!allTerminal) {
            return ReviewStatus.IN_PROGRESS;
        }
        return anyNeedsWork ? ReviewStatus.NEEDS_WORK : ReviewStatus.APPROVED;
    }
}
