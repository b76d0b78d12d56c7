package dev.logicojp.reviewthreads.devops;

import java.util.Objects;

/// Identifies the pull request whose threads are created or updated.
/// @param repoId repository id (GUID)
/// @param prId pull request id
public record PullRequestRef(String repoId, long prId) {

    public PullRequestRef {
        Objects.requireNonNull(repoId, "repoId");
        if (prId <= 0) {
            throw new IllegalArgumentException("Pull request id must be positive: " + prId);
        }
    }
}
