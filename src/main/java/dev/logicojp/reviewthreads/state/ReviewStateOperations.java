package dev.logicojp.reviewthreads.state;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Lookups and in-place mutations of a {@link ReviewState}.
///
/// Every mutation returns the same instance it was given. Paths may be passed
/// with or without a leading slash.
public final class ReviewStateOperations {

    private ReviewStateOperations() {
    }

    public static Optional<FileEntry> getFileEntry(ReviewState state, String filePath) {
        return Optional.ofNullable(state.getFiles().get(ReviewPaths.normalize(filePath)));
    }

    public static Optional<FolderEntry> getFolderEntry(ReviewState state, String folderName) {
        return Optional.ofNullable(state.getFolders().get(folderName));
    }

    /// @throws ReviewEntryNotFoundException if the file is not tracked
    public static FileEntry requireFileEntry(ReviewState state, String filePath) {
        String normalized = ReviewPaths.normalize(filePath);
        FileEntry entry = state.getFiles().get(normalized);
        if (entry == null) {
            throw ReviewEntryNotFoundException.file(normalized);
        }
        return entry;
    }

    /// @throws ReviewEntryNotFoundException if the folder is not tracked
    public static FolderEntry requireFolderEntry(ReviewState state, String folderName) {
        FolderEntry entry = state.getFolders().get(folderName);
        if (entry == null) {
            throw ReviewEntryNotFoundException.folder(folderName);
        }
        return entry;
    }

    /// Sets a file's status. Summary and suggestions are replaced only when non-null.
    public static ReviewState updateFileStatus(ReviewState state, String filePath, ReviewStatus status,
                                               String summary, List<SuggestionEntry> suggestions) {
        Objects.requireNonNull(status, "status");
        FileEntry entry = requireFileEntry(state, filePath);
        entry.setStatus(status);
        if (summary != null) {
            entry.setSummary(summary);
        }
        if (suggestions != null) {
            entry.setSuggestions(suggestions);
        }
        return state;
    }

    public static ReviewState updateFileStatus(ReviewState state, String filePath, ReviewStatus status) {
        return updateFileStatus(state, filePath, status, null, null);
    }

    public static ReviewState addSuggestionToFile(ReviewState state, String filePath, SuggestionEntry suggestion) {
        Objects.requireNonNull(suggestion, "suggestion");
        requireFileEntry(state, filePath).getSuggestions().add(suggestion);
        return state;
    }

    /// Moves a reviewed file's suggestions to `previousSuggestions` before a re-review.
    ///
    /// Applies only to terminal files that were never rotated. A file that was
    /// already rotated keeps both lists untouched, so a retried re-review cannot
    /// overwrite the rotated suggestions with the new ones.
    public static ReviewState clearSuggestionsForReReview(ReviewState state, String filePath) {
        FileEntry entry = requireFileEntry(state, filePath);
        if (!entry.getStatus().isTerminal() || entry.previousSuggestions().isPresent()) {
            return state;
        }
        entry.setPreviousSuggestions(entry.getSuggestions());
        entry.setSuggestions(List.of());
        return state;
    }
}
