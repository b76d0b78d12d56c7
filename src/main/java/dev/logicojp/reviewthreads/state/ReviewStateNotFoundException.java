package dev.logicojp.reviewthreads.state;

import java.io.IOException;
import java.nio.file.Path;

/// Thrown when no persisted review state exists for a pull request.
///
/// The scaffolder treats this as "not scaffolded yet" rather than as a failure.
public final class ReviewStateNotFoundException extends IOException {

    private final long prId;

    public ReviewStateNotFoundException(long prId, Path stateFile) {
        super("Review state not found for PR " + prId + ": " + stateFile);
        this.prId = prId;
    }

    public long prId() {
        return prId;
    }
}
