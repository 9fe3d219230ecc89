package io.lintsignal.config;

/**
 * Thrown when a configuration file is well-formed YAML but does not describe a valid configuration.
 */
public class ConfigurationException extends Exception {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
