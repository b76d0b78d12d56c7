package dev.logicojp.reviewthreads;

import dev.logicojp.reviewthreads.cli.CompleteCommand;
import dev.logicojp.reviewthreads.cli.ReopenCommand;
import dev.logicojp.reviewthreads.cli.ScaffoldCommand;
import dev.logicojp.reviewthreads.cli.ShowCommand;
import dev.logicojp.reviewthreads.cli.StartCommand;
import dev.logicojp.reviewthreads.cli.SuggestCommand;
import io.micronaut.configuration.picocli.PicocliRunner;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Pull request review thread CLI.
 *
 * Scaffolds one summary thread per changed file, per top-level folder and
 * for the whole pull request, then keeps them in sync while files are
 * reviewed. The review state lives in a local JSON file per pull request.
 *
 * Built with Micronaut Picocli integration for dependency injection support.
 */
@Command(
    name = "review-threads",
    mixinStandardHelpOptions = true,
    version = "Review Threads 1.0.0",
    description = "Scaffold and maintain pull request review summary threads.",
    subcommands = {
        ScaffoldCommand.class,
        StartCommand.class,
        ReopenCommand.class,
        CompleteCommand.class,
        SuggestCommand.class,
        ShowCommand.class
    }
)
public class ReviewThreadsApp implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    void setVerbose(boolean verbose) {
        if (verbose) {
            LogbackLevelSwitcher.setDebug();
        }
    }

    public static void main(String[] args) {
        int exitCode = PicocliRunner.execute(ReviewThreadsApp.class, args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // When no subcommand is specified, show help
        System.out.println("Use 'review-threads scaffold' to create the summary threads of a pull request.");
        System.out.println("Use --help for more information.");
    }
}
