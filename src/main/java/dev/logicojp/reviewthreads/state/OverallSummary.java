package dev.logicojp.reviewthreads.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/// PR-level summary thread. Its ids stay `0` until the thread is created.
@JsonPropertyOrder({"threadId", "commentId", "status"})
public final class OverallSummary {

    private long threadId;
    private long commentId;
    private ReviewStatus status;

    @JsonCreator
    public OverallSummary(@JsonProperty("threadId") long threadId,
                          @JsonProperty("commentId") long commentId,
                          @JsonProperty("status") ReviewStatus status) {
        this.threadId = threadId;
        this.commentId = commentId;
        this.status = status == null ? ReviewStatus.UNREVIEWED : status;
    }

    /// Summary whose thread has not been created yet.
    public static OverallSummary unassigned() {
        return new OverallSummary(0, 0, ReviewStatus.UNREVIEWED);
    }

    @JsonProperty("threadId")
    public long getThreadId() {
        return threadId;
    }

    @JsonProperty("commentId")
    public long getCommentId() {
        return commentId;
    }

    public boolean hasThread() {
        return threadId != 0;
    }

    /// Stores the ids of the created thread.
    /// @throws IllegalStateException if a thread was already assigned
    public void assignThread(long threadId, long commentId) {
        if (hasThread()) {
            throw new IllegalStateException(
                "Overall summary thread already assigned: " + this.threadId);
        }
        if (threadId == 0 || commentId == 0) {
            throw new IllegalArgumentException("Thread and comment ids must be non-zero");
        }
        this.threadId = threadId;
        this.commentId = commentId;
    }

    @JsonProperty("status")
    public ReviewStatus getStatus() {
        return status;
    }

    public void setStatus(ReviewStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    @Override
    public String toString() {
        return "OverallSummary{status=%s, threadId=%d}".formatted(status, threadId);
    }
}
