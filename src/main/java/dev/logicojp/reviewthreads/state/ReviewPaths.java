package dev.logicojp.reviewthreads.state;

/// Repository path helpers shared by the store, the scaffolder and the cascade.
public final class ReviewPaths {

    /// Folder assigned to files that live directly at the repository root.
    public static final String ROOT_FOLDER = "root";

    private ReviewPaths() {
    }

    /// Ensures the path starts with `/`. Backslashes are converted to `/`.
    public static String normalize(String filePath) {
        if (filePath == null || filePath.isBlank()) {
            throw new IllegalArgumentException("File path must not be blank");
        }
        String path = filePath.trim().replace('\\', '/');
        return path.startsWith("/") ? path : "/" + path;
    }

    /// Returns the first path segment, or {@value #ROOT_FOLDER} for root-level files.
    public static String topLevelFolder(String filePath) {
        if (filePath == null || filePath.isBlank()) {
            return ROOT_FOLDER;
        }
        String relative = normalize(filePath).substring(1);
        int slash = relative.indexOf('/');
        if (slash <= 0) {
            return ROOT_FOLDER;
        }
        return relative.substring(0, slash);
    }

    /// Returns the last path segment.
    public static String fileName(String filePath) {
        String normalized = normalize(filePath);
        return normalized.substring(normalized.lastIndexOf('/') + 1);
    }
}
