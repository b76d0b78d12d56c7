package dev.logicojp.reviewthreads.devops;

/// Raised when the discussion thread API fails or answers with a non-success status.
public final class ThreadApiException extends RuntimeException {

    /// Status code used when no HTTP response was received.
    public static final int NO_RESPONSE = -1;

    private final int statusCode;

    public ThreadApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ThreadApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_RESPONSE;
    }

    public int statusCode() {
        return statusCode;
    }
}
