package dev.logicojp.reviewthreads.cli;

/// CLI exit codes using simplified values commonly used in CLI tools.
///
/// | Code | Meaning                       |
/// |------|-------------------------------|
/// | 0    | Successful execution          |
/// | 1    | Review state or API failure   |
/// | 2    | Invalid command-line usage    |
public final class ExitCodes {
    public static final int OK = 0;
    public static final int SOFTWARE = 1;
    public static final int USAGE = 2;

    private ExitCodes() {
    }
}
