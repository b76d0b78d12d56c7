package dev.logicojp.reviewthreads.config;

/// Shared default-value helpers for configuration records.
final class ConfigDefaults {

    private ConfigDefaults() {
    }

    static String defaultIfBlank(String value, String defaultValue) {
        return (value == null || value.isBlank()) ? defaultValue : value;
    }

    static Integer defaultIfNonPositive(Integer value, int defaultValue) {
        return (value == null || value <= 0) ? defaultValue : value;
    }
}
