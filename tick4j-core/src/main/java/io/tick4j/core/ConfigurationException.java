package io.tick4j.core;

/**
 * Invalid registration or run configuration. Raised immediately to the caller.
 */
public class ConfigurationException extends Tick4jException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
