package dev.logicojp.reviewthreads.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.logicojp.reviewthreads.config.StateConfig;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/// Loads and saves one `review-state.json` per pull request.
///
/// A single local process is assumed to own the file; there is no locking.
@Singleton
public class ReviewStateStore {

    private static final Logger logger = LoggerFactory.getLogger(ReviewStateStore.class);

    private final StateConfig config;
    private final ObjectMapper mapper;

    @Inject
    public ReviewStateStore(StateConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /// Path of the state file for a pull request, whether it exists or not.
    public Path stateFile(long prId) {
        return config.stateFile(prId);
    }

    public boolean exists(long prId) {
        return Files.isRegularFile(stateFile(prId));
    }

    /// Loads the persisted state for a pull request.
    /// @throws ReviewStateNotFoundException if nothing was saved for the PR yet
    public ReviewState load(long prId) throws IOException {
        Path file = stateFile(prId);
        if (!Files.isRegularFile(file)) {
            throw new ReviewStateNotFoundException(prId, file);
        }
        logger.debug("Loading review state from {}", file);
        return fromJson(Files.readString(file));
    }

    /// Writes the full state, creating parent directories as needed.
    public void save(ReviewState state) throws IOException {
        Path file = stateFile(state.getPrId());
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            StateFileUtils.ensureDirectory(parent);
        }
        StateFileUtils.replaceContent(file, toJson(state));
        logger.debug("Saved review state for PR {} to {}", state.getPrId(), file);
    }

    public String toJson(ReviewState state) throws JsonProcessingException {
        return mapper.writeValueAsString(state);
    }

    public ReviewState fromJson(String json) throws JsonProcessingException {
        return mapper.readValue(json, ReviewState.class);
    }
}
