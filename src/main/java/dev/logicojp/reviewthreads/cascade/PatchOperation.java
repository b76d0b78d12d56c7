package dev.logicojp.reviewthreads.cascade;

import dev.logicojp.reviewthreads.devops.ThreadStatus;

import java.util.Objects;

/// One summary thread to bring in sync: new comment content, then new thread status.
public record PatchOperation(long threadId, long commentId, String newContent, ThreadStatus threadStatus) {

    public PatchOperation {
        Objects.requireNonNull(newContent, "newContent");
        Objects.requireNonNull(threadStatus, "threadStatus");
    }
}
