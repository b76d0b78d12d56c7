package dev.logicojp.reviewthreads.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Review state of a top-level folder and its summary thread.
/// The status is always derived from the files listed here.
@JsonPropertyOrder({"threadId", "commentId", "status", "files"})
public final class FolderEntry {

    private final long threadId;
    private final long commentId;
    private ReviewStatus status;
    private final List<String> files;

    public FolderEntry(long threadId, long commentId, List<String> files) {
        this(threadId, commentId, ReviewStatus.UNREVIEWED, files);
    }

    @JsonCreator
    public FolderEntry(@JsonProperty("threadId") long threadId,
                       @JsonProperty("commentId") long commentId,
                       @JsonProperty("status") ReviewStatus status,
                       @JsonProperty("files") List<String> files) {
        this.threadId = threadId;
        this.commentId = commentId;
        this.status = status == null ? ReviewStatus.UNREVIEWED : status;
        List<String> normalized = new ArrayList<>();
        if (files != null) {
            for (String file : files) {
                normalized.add(ReviewPaths.normalize(file));
            }
        }
        this.files = Collections.unmodifiableList(normalized);
    }

    @JsonProperty("threadId")
    public long getThreadId() {
        return threadId;
    }

    @JsonProperty("commentId")
    public long getCommentId() {
        return commentId;
    }

    @JsonProperty("status")
    public ReviewStatus getStatus() {
        return status;
    }

    public void setStatus(ReviewStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    /// Normalized file paths, in the order the files were scaffolded.
    @JsonProperty("files")
    public List<String> getFiles() {
        return files;
    }

    @Override
    public String toString() {
        return "FolderEntry{status=%s, threadId=%d, files=%d}".formatted(status, threadId, files.size());
    }
}
