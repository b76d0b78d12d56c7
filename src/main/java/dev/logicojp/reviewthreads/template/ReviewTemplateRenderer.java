package dev.logicojp.reviewthreads.template;

import dev.logicojp.reviewthreads.state.FileEntry;
import dev.logicojp.reviewthreads.state.FolderEntry;
import dev.logicojp.reviewthreads.state.ReviewPaths;
import dev.logicojp.reviewthreads.state.ReviewState;
import dev.logicojp.reviewthreads.state.ReviewStatus;
import dev.logicojp.reviewthreads.state.Severity;
import dev.logicojp.reviewthreads.state.SuggestionEntry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/// Renders the markdown bodies of file, folder and overall summary comments.
///
/// Rendering is a pure function of its arguments; links point at discussion
/// threads below the pull request web URL.
public final class ReviewTemplateRenderer {

    private static final String AWAITING_REVIEW = "Awaiting review...";
    private static final String REVIEW_IN_PROGRESS = "Review in progress...";

    /// Section order for folder and overall listings.
    private static final List<ReviewStatus> SECTION_ORDER = List.of(
        ReviewStatus.NEEDS_WORK, ReviewStatus.APPROVED, ReviewStatus.IN_PROGRESS, ReviewStatus.UNREVIEWED);

    private ReviewTemplateRenderer() {
        // utility class
    }

    /// Builds `<baseUrl>?discussionId=<threadId>&commentId=<commentId>`.
    public static String discussionUrl(String baseUrl, long threadId, long commentId) {
        return "%s?discussionId=%d&commentId=%d".formatted(baseUrl, threadId, commentId);
    }

    /// Renders the summary comment of one file.
    /// @param filePath repository path of the file, with or without leading slash
    /// @param entry file state; its suggestions are listed when it needs work
    /// @param baseUrl pull request web URL
    public static String renderFileSummary(String filePath, FileEntry entry, String baseUrl) {
        List<String> lines = new ArrayList<>();
        lines.add("## File Review Summary: " + entry.getFileName());
        lines.add("");
        lines.add("*Complete Path:* " + ReviewPaths.normalize(filePath));
        lines.add("");
        lines.add("*Status:* " + entry.getStatus().displayName());
        lines.add("");
        lines.add("### Summary of Changes");

        switch (entry.getStatus()) {
            case UNREVIEWED -> {
                lines.add(AWAITING_REVIEW);
                lines.add("");
                lines.add("### Suggestions");
                lines.add(AWAITING_REVIEW);
            }
            case IN_PROGRESS -> {
                lines.add(REVIEW_IN_PROGRESS);
                lines.add("");
                lines.add("### Suggestions");
                lines.add(REVIEW_IN_PROGRESS);
            }
            case APPROVED -> {
                lines.add(nullToEmpty(entry.getSummary()));
                lines.add("");
                lines.add("### Suggestions");
                lines.add("- None");
            }
            case NEEDS_WORK -> {
                lines.add(nullToEmpty(entry.getSummary()));
                lines.add("");
                lines.add("### Suggestions");
                appendSuggestionSections(lines, entry.getSuggestions(), baseUrl);
            }
        }
        return String.join("\n", lines);
    }

    private static void appendSuggestionSections(List<String> lines, List<SuggestionEntry> suggestions,
                                                 String baseUrl) {
        Map<Severity, List<SuggestionEntry>> bySeverity = new EnumMap<>(Severity.class);
        for (SuggestionEntry suggestion : suggestions) {
            bySeverity.computeIfAbsent(suggestion.severity(), ignored -> new ArrayList<>()).add(suggestion);
        }
        for (Severity severity : Severity.values()) {
            List<SuggestionEntry> group = bySeverity.get(severity);
            if (group == null) {
                continue;
            }
            lines.add("");
            lines.add("#### " + severity.sectionTitle());
            for (SuggestionEntry suggestion : group) {
                String url = discussionUrl(baseUrl, suggestion.threadId(), suggestion.commentId());
                String item = "[%s](%s)".formatted(suggestion.linkText(), url);
                if (suggestion.outOfScope()) {
                    item += " *(out of scope)*";
                }
                lines.add("- " + item);
            }
        }
    }

    /// Renders the summary comment of a folder, linking every file thread.
    /// @param files all tracked files, keyed by normalized path
    public static String renderFolderSummary(String folderName, FolderEntry folder,
                                             Map<String, FileEntry> files, String baseUrl) {
        Map<ReviewStatus, List<String>> sections = new EnumMap<>(ReviewStatus.class);
        for (String path : folder.getFiles()) {
            FileEntry file = files.get(path);
            if (file == null) {
                continue;
            }
            String url = discussionUrl(baseUrl, file.getThreadId(), file.getCommentId());
            String item = "[%s](%s)".formatted(path, url);
            if (file.getStatus() == ReviewStatus.NEEDS_WORK) {
                String counts = formatSeverityCounts(file.getSuggestions());
                if (!counts.isEmpty()) {
                    item += " — " + counts;
                }
            }
            sections.computeIfAbsent(file.getStatus(), ignored -> new ArrayList<>()).add(item);
        }

        List<String> lines = new ArrayList<>();
        lines.add("## Folder Review Summary: " + folderName);
        lines.add("");
        lines.add("*Status:* " + folder.getStatus().displayName());
        appendSections(lines, sections);
        return String.join("\n", lines);
    }

    /// Renders the pull request level summary comment, linking every folder thread.
    public static String renderOverallSummary(ReviewState state, String baseUrl) {
        Map<ReviewStatus, List<String>> sections = new EnumMap<>(ReviewStatus.class);
        for (Map.Entry<String, FolderEntry> entry : state.getFolders().entrySet()) {
            FolderEntry folder = entry.getValue();
            String url = discussionUrl(baseUrl, folder.getThreadId(), folder.getCommentId());
            sections.computeIfAbsent(folder.getStatus(), ignored -> new ArrayList<>())
                .add("[%s](%s)".formatted(entry.getKey(), url));
        }

        List<String> lines = new ArrayList<>();
        lines.add("## Overall PR Review Summary");
        lines.add("");
        lines.add("*Status:* " + state.getOverallSummary().getStatus().displayName());
        appendSections(lines, sections);
        return String.join("\n", lines);
    }

    private static void appendSections(List<String> lines, Map<ReviewStatus, List<String>> sections) {
        for (ReviewStatus status : SECTION_ORDER) {
            List<String> items = sections.get(status);
            if (items == null) {
                continue;
            }
            lines.add("");
            lines.add("### " + status.displayName());
            for (String item : items) {
                lines.add("- " + item);
            }
        }
    }

    /// Formats counts such as `2 High, 1 Medium`; empty when there are no suggestions.
    static String formatSeverityCounts(List<SuggestionEntry> suggestions) {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (SuggestionEntry suggestion : suggestions) {
            counts.merge(suggestion.severity(), 1, Integer::sum);
        }
        StringJoiner joiner = new StringJoiner(", ");
        for (Severity severity : Severity.values()) {
            Integer count = counts.get(severity);
            if (count != null) {
                joiner.add(count + " " + severity.label());
            }
        }
        return joiner.toString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
