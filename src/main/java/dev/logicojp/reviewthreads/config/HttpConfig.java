package dev.logicojp.reviewthreads.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.core.annotation.Nullable;

import java.time.Duration;

/// Timeouts for calls to the discussion thread API.
/// Missing or non-positive values fall back to the defaults.
@ConfigurationProperties("reviewer.http")
public record HttpConfig(
    @Nullable Integer connectTimeoutSeconds,
    @Nullable Integer requestTimeoutSeconds
) {

    public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 20;
    public static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;

    public HttpConfig {
        connectTimeoutSeconds = ConfigDefaults.defaultIfNonPositive(
            connectTimeoutSeconds, DEFAULT_CONNECT_TIMEOUT_SECONDS);
        requestTimeoutSeconds = ConfigDefaults.defaultIfNonPositive(
            requestTimeoutSeconds, DEFAULT_REQUEST_TIMEOUT_SECONDS);
    }

    public HttpConfig() {
        this(DEFAULT_CONNECT_TIMEOUT_SECONDS, DEFAULT_REQUEST_TIMEOUT_SECONDS);
    }

    public Duration connectTimeout() {
        return Duration.ofSeconds(connectTimeoutSeconds);
    }

    public Duration requestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }
}
