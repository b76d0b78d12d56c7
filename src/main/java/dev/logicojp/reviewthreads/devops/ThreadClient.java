package dev.logicojp.reviewthreads.devops;

/// Discussion thread capability consumed by the scaffolder and the cascade.
///
/// Implementations throw {@link ThreadApiException} on any failure; callers do
/// not retry. In dry-run mode the patch calls perform no network I/O.
public interface ThreadClient {

    /// Creates a thread with a single text comment.
    /// @param anchor file context, or {@code null} for a PR-level thread
    CreatedThread createThread(PullRequestRef pullRequest, String content, ThreadAnchor anchor);

    /// Replaces the content of an existing comment.
    void patchComment(PullRequestRef pullRequest, long threadId, long commentId, String content, boolean dryRun);

    /// Sets the status of an existing thread.
    void patchThreadStatus(PullRequestRef pullRequest, long threadId, ThreadStatus status, boolean dryRun);
}
