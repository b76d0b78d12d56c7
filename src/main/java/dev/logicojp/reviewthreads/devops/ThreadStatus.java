package dev.logicojp.reviewthreads.devops;

/// Status of a discussion thread on the pull request.
public enum ThreadStatus {
    ACTIVE("active"),
    CLOSED("closed");

    private final String value;

    ThreadStatus(String value) {
        this.value = value;
    }

    /// Value sent to the thread API.
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
