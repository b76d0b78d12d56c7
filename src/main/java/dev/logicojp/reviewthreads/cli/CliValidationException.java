package dev.logicojp.reviewthreads.cli;

/// Invalid command-line input; reported with exit code {@link ExitCodes#USAGE}.
public final class CliValidationException extends RuntimeException {
    private final boolean showUsage;

    public CliValidationException(String message, boolean showUsage) {
        super(message);
        this.showUsage = showUsage;
    }

    public CliValidationException(String message, boolean showUsage, Throwable cause) {
        super(message, cause);
        this.showUsage = showUsage;
    }

    public boolean showUsage() {
        return showUsage;
    }
}
