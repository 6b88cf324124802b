package io.github.genie.sonyflake.core.support;

/**
 * Thrown when a generator cannot be built from the supplied configuration.
 */
public class ConfigurationException extends SonyflakeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

}
