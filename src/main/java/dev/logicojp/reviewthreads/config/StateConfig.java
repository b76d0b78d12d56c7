package dev.logicojp.reviewthreads.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.core.annotation.Nullable;

import java.nio.file.Path;

/**
 * Configuration for where review state files are kept.
 *
 * <p>Each pull request gets its own file at
 * {@code <directory>/pull-request-review/prompts/<prId>/review-state.json}.</p>
 */
@ConfigurationProperties("reviewer.state")
public record StateConfig(@Nullable String directory) {

    public static final String DEFAULT_DIRECTORY = ".review-state";
    static final String STATE_FILE_NAME = "review-state.json";

    public StateConfig {
        directory = ConfigDefaults.defaultIfBlank(directory, DEFAULT_DIRECTORY);
    }

    public StateConfig() {
        this(DEFAULT_DIRECTORY);
    }

    /**
     * Resolves the state file for a pull request.
     * @param prId pull request id
     * @return path of {@code review-state.json} for that PR
     */
    public Path stateFile(long prId) {
        return Path.of(directory)
            .resolve("pull-request-review")
            .resolve("prompts")
            .resolve(Long.toString(prId))
            .resolve(STATE_FILE_NAME);
    }
}
