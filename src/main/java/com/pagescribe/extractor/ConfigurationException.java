package com.pagescribe.extractor;

/**
 * Thrown when the run configuration is unusable. Always raised before any extraction task is dispatched.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
