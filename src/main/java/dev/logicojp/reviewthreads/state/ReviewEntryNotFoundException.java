package dev.logicojp.reviewthreads.state;

/// Thrown when a file path or folder name is not tracked in a review state.
public final class ReviewEntryNotFoundException extends RuntimeException {

    public ReviewEntryNotFoundException(String message) {
        super(message);
    }

    public static ReviewEntryNotFoundException file(String normalizedPath) {
        return new ReviewEntryNotFoundException("File not found in review state: " + normalizedPath);
    }

    public static ReviewEntryNotFoundException folder(String folderName) {
        return new ReviewEntryNotFoundException("Folder not found in review state: " + folderName);
    }
}
