package dev.logicojp.reviewthreads.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Review state of a single changed file and its summary thread.
///
/// `previousSuggestions` distinguishes "never rotated" (empty `Optional`)
/// from "rotated to zero items" (an empty list). A retried re-review relies
/// on that difference to avoid rotating twice and dropping live suggestions.
@JsonPropertyOrder({"threadId", "commentId", "folder", "fileName", "status", "summary",
    "changeTrackingId", "suggestions", "previousSuggestions"})
public final class FileEntry {

    private final long threadId;
    private final long commentId;
    private final String folder;
    private final String fileName;
    private ReviewStatus status;
    private String summary;
    private Long changeTrackingId;
    private List<SuggestionEntry> suggestions;
    private List<SuggestionEntry> previousSuggestions;

    public FileEntry(long threadId, long commentId, String folder, String fileName) {
        this(threadId, commentId, folder, fileName, ReviewStatus.UNREVIEWED, null, null, null, null);
    }

    @JsonCreator
    public FileEntry(@JsonProperty("threadId") long threadId,
                     @JsonProperty("commentId") long commentId,
                     @JsonProperty("folder") String folder,
                     @JsonProperty("fileName") String fileName,
                     @JsonProperty("status") ReviewStatus status,
                     @JsonProperty("summary") String summary,
                     @JsonProperty("changeTrackingId") Long changeTrackingId,
                     @JsonProperty("suggestions") List<SuggestionEntry> suggestions,
                     @JsonProperty("previousSuggestions") List<SuggestionEntry> previousSuggestions) {
        this.threadId = threadId;
        this.commentId = commentId;
        this.folder = Objects.requireNonNull(folder, "folder");
        this.fileName = Objects.requireNonNull(fileName, "fileName");
        this.status = status == null ? ReviewStatus.UNREVIEWED : status;
        this.summary = summary;
        this.changeTrackingId = changeTrackingId;
        this.suggestions = suggestions == null ? new ArrayList<>() : new ArrayList<>(suggestions);
        this.previousSuggestions = previousSuggestions == null ? null : new ArrayList<>(previousSuggestions);
    }

    @JsonProperty("threadId")
    public long getThreadId() {
        return threadId;
    }

    @JsonProperty("commentId")
    public long getCommentId() {
        return commentId;
    }

    @JsonProperty("folder")
    public String getFolder() {
        return folder;
    }

    @JsonProperty("fileName")
    public String getFileName() {
        return fileName;
    }

    @JsonProperty("status")
    public ReviewStatus getStatus() {
        return status;
    }

    public void setStatus(ReviewStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    @JsonProperty("summary")
    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    @JsonProperty("changeTrackingId")
    public Long getChangeTrackingId() {
        return changeTrackingId;
    }

    public void setChangeTrackingId(Long changeTrackingId) {
        this.changeTrackingId = changeTrackingId;
    }

    /// Live suggestions, in posting order. The returned list is the backing list.
    @JsonProperty("suggestions")
    public List<SuggestionEntry> getSuggestions() {
        return suggestions;
    }

    public void setSuggestions(List<SuggestionEntry> suggestions) {
        this.suggestions = new ArrayList<>(Objects.requireNonNull(suggestions, "suggestions"));
    }

    public Optional<List<SuggestionEntry>> previousSuggestions() {
        return Optional.ofNullable(previousSuggestions);
    }

    /// Records the rotated suggestions. Once set it is never cleared back to "not rotated".
    public void setPreviousSuggestions(List<SuggestionEntry> previousSuggestions) {
        this.previousSuggestions = new ArrayList<>(
            Objects.requireNonNull(previousSuggestions, "previousSuggestions"));
    }

    @JsonProperty("previousSuggestions")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<SuggestionEntry> getPreviousSuggestionsOrNull() {
        return previousSuggestions;
    }

    @Override
    public String toString() {
        return "FileEntry{folder='%s', fileName='%s', status=%s, threadId=%d, suggestions=%d}"
            .formatted(folder, fileName, status, threadId, suggestions.size());
    }
}
