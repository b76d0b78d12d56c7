package dev.logicojp.reviewthreads.scaffold;

import java.util.List;
import java.util.Objects;

/// Input of a scaffolding run.
/// @param prId pull request id
/// @param repoId repository id (GUID) used by the thread API
/// @param repoName repository name stored with the state
/// @param latestIterationId latest PR iteration at scaffold time
/// @param files changed file paths, with or without leading slash
public record ScaffoldRequest(long prId, String repoId, String repoName, long latestIterationId, List<String> files) {

    public ScaffoldRequest {
        Objects.requireNonNull(repoId, "repoId");
        Objects.requireNonNull(repoName, "repoName");
        files = List.copyOf(Objects.requireNonNull(files, "files"));
    }
}
