package dev.logicojp.reviewthreads.cli;

import dev.logicojp.reviewthreads.state.ReviewStatus;
import dev.logicojp.reviewthreads.state.Severity;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintStream;
import java.util.concurrent.Callable;

/// Shared exit-code handling of the subcommands.
///
/// Subcommands implement {@link #execute()}; validation failures map to
/// {@link ExitCodes#USAGE}, everything else to {@link ExitCodes#SOFTWARE}.
abstract class AbstractReviewCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(AbstractReviewCommand.class);

    @Spec
    CommandSpec spec;

    @Inject
    @Named("stdout")
    PrintStream out;

    @Inject
    @Named("stderr")
    PrintStream err;

    protected abstract int execute() throws Exception;

    @Override
    public Integer call() {
        try {
            return execute();
        } catch (CliValidationException e) {
            err.println("Error: " + e.getMessage());
            if (e.showUsage() && spec != null) {
                spec.commandLine().usage(err);
            }
            return ExitCodes.USAGE;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return ExitCodes.USAGE;
        } catch (Exception e) {
            logger.error("Command failed: {}", e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            return ExitCodes.SOFTWARE;
        }
    }

    static ReviewStatus parseStatus(String value) {
        try {
            return ReviewStatus.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new CliValidationException(e.getMessage(), true, e);
        }
    }

    static Severity parseSeverity(String value) {
        try {
            return Severity.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new CliValidationException(e.getMessage(), true, e);
        }
    }
}
