package com.rulewise.core.config;

/**
 * Thrown when settings, the rule catalog or a built-in lookup table is invalid.
 * Always fatal: the request (or application start) fails without retry.
 */
public class ConfigurationException extends RuntimeException {

    private final String configKey;

    public ConfigurationException(String message) {
        this(message, null, null);
    }

    public ConfigurationException(String message, String configKey) {
        this(message, configKey, null);
    }

    public ConfigurationException(String message, String configKey, Throwable cause) {
        super(message, cause);
        this.configKey = configKey;
    }

    /** The offending setting, or {@code null} when not tied to a single key. */
    public String getConfigKey() {
        return configKey;
    }
}
