package dev.logicojp.reviewthreads.scaffold;

import dev.logicojp.reviewthreads.state.ReviewPaths;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/// Threads the scaffolder is going to create for a pull request.
///
/// Files are normalized and de-duplicated, keeping their first position.
/// Folders appear in the order their first file appears.
public record ScaffoldPlan(long prId, List<String> files, Map<String, List<String>> folders) {

    public ScaffoldPlan {
        files = List.copyOf(files);
        Map<String, List<String>> copy = new LinkedHashMap<>();
        folders.forEach((name, paths) -> copy.put(name, List.copyOf(paths)));
        folders = Collections.unmodifiableMap(copy);
    }

    /// Groups the changed files by top-level folder.
    public static ScaffoldPlan of(long prId, List<String> changedFiles) {
        LinkedHashSet<String> normalized = new LinkedHashSet<>();
        for (String file : changedFiles) {
            normalized.add(ReviewPaths.normalize(file));
        }
        Map<String, List<String>> folders = new LinkedHashMap<>();
        for (String path : normalized) {
            folders.computeIfAbsent(ReviewPaths.topLevelFolder(path), ignored -> new ArrayList<>()).add(path);
        }
        return new ScaffoldPlan(prId, new ArrayList<>(normalized), folders);
    }

    /// One call per file, one per folder, one for the overall summary.
    public int apiCallCount() {
        return files.size() + folders.size() + 1;
    }

    /// Human readable dry-run listing.
    public List<String> describe() {
        List<String> lines = new ArrayList<>();
        lines.add("[DRY RUN] Scaffolding plan for PR %d:".formatted(prId));
        for (String file : files) {
            lines.add("  [DRY RUN] Would create file summary thread for " + file);
        }
        for (String folder : folders.keySet()) {
            lines.add("  [DRY RUN] Would create folder summary thread for " + folder);
        }
        lines.add("  [DRY RUN] Would create overall PR summary thread");
        lines.add("  [DRY RUN] Total API calls: " + apiCallCount());
        return lines;
    }
}
