package dev.logicojp.reviewthreads.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Root aggregate of a pull request review: one instance per PR id.
///
/// The instance is mutated in place by the scaffolder and the cascade, and is
/// owned by a single process at a time. Folder and file maps keep insertion
/// order so rendered summaries list entries in scaffold order.
@JsonPropertyOrder({"prId", "repoId", "repoName", "project", "organization",
    "latestIterationId", "scaffoldedUtc", "overallSummary", "folders", "files"})
public final class ReviewState {

    private final long prId;
    private final String repoId;
    private final String repoName;
    private final String project;
    private final String organization;
    private final long latestIterationId;
    private final String scaffoldedUtc;
    private final OverallSummary overallSummary;
    private final Map<String, FolderEntry> folders = new LinkedHashMap<>();
    private final Map<String, FileEntry> files = new LinkedHashMap<>();

    public ReviewState(long prId, String repoId, String repoName, String project, String organization,
                       long latestIterationId, String scaffoldedUtc) {
        this(prId, repoId, repoName, project, organization, latestIterationId, scaffoldedUtc,
            OverallSummary.unassigned(), null, null);
    }

    @JsonCreator
    public ReviewState(@JsonProperty("prId") long prId,
                       @JsonProperty("repoId") String repoId,
                       @JsonProperty("repoName") String repoName,
                       @JsonProperty("project") String project,
                       @JsonProperty("organization") String organization,
                       @JsonProperty("latestIterationId") long latestIterationId,
                       @JsonProperty("scaffoldedUtc") String scaffoldedUtc,
                       @JsonProperty("overallSummary") OverallSummary overallSummary,
                       @JsonProperty("folders") Map<String, FolderEntry> folders,
                       @JsonProperty("files") Map<String, FileEntry> files) {
        this.prId = prId;
        this.repoId = repoId;
        this.repoName = repoName;
        this.project = project;
        this.organization = organization;
        this.latestIterationId = latestIterationId;
        this.scaffoldedUtc = scaffoldedUtc;
        this.overallSummary = overallSummary == null ? OverallSummary.unassigned() : overallSummary;
        if (folders != null) {
            this.folders.putAll(folders);
        }
        if (files != null) {
            files.forEach(this::putFile);
        }
    }

    @JsonProperty("prId")
    public long getPrId() {
        return prId;
    }

    @JsonProperty("repoId")
    public String getRepoId() {
        return repoId;
    }

    @JsonProperty("repoName")
    public String getRepoName() {
        return repoName;
    }

    @JsonProperty("project")
    public String getProject() {
        return project;
    }

    @JsonProperty("organization")
    public String getOrganization() {
        return organization;
    }

    @JsonProperty("latestIterationId")
    public long getLatestIterationId() {
        return latestIterationId;
    }

    @JsonProperty("scaffoldedUtc")
    public String getScaffoldedUtc() {
        return scaffoldedUtc;
    }

    @JsonProperty("overallSummary")
    public OverallSummary getOverallSummary() {
        return overallSummary;
    }

    @JsonProperty("folders")
    public Map<String, FolderEntry> getFolders() {
        return Collections.unmodifiableMap(folders);
    }

    @JsonProperty("files")
    public Map<String, FileEntry> getFiles() {
        return Collections.unmodifiableMap(files);
    }

    /// Adds or replaces a file entry under its normalized path.
    public void putFile(String filePath, FileEntry entry) {
        files.put(ReviewPaths.normalize(filePath), Objects.requireNonNull(entry, "entry"));
    }

    /// Adds or replaces a folder entry. Every listed file must already be tracked.
    public void putFolder(String folderName, FolderEntry entry) {
        Objects.requireNonNull(entry, "entry");
        for (String file : entry.getFiles()) {
            if (!files.containsKey(file)) {
                throw new IllegalArgumentException(
                    "Folder '" + folderName + "' references untracked file: " + file);
            }
        }
        folders.put(folderName, entry);
    }

    @Override
    public String toString() {
        return "ReviewState{prId=%d, repoName='%s', folders=%d, files=%d, overall=%s}"
            .formatted(prId, repoName, folders.size(), files.size(), overallSummary.getStatus());
    }
}
