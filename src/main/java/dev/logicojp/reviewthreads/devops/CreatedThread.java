package dev.logicojp.reviewthreads.devops;

/// Ids of a newly created thread and its first comment.
public record CreatedThread(long threadId, long commentId) {
}
