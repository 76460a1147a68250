package com.chronoread.exception;

/**
 * Exception thrown when an operation or its runtime dependencies are configured
 * inconsistently.
 *
 * <p>Configuration errors are detected before planning starts, for example
 * when a read names both a bucket and a bucket id, or when the dependencies
 * handed to source construction are incomplete. They are never retryable.
 */
public class ConfigurationException extends RuntimeException {

    /**
     * Creates a configuration exception.
     *
     * @param message the error message
     */
    public ConfigurationException(String message) {
        super(message);
    }
}
