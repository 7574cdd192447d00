package com.nowqueue.exception;

/**
 * Exception thrown when configuration is invalid.
 * Results in fail-fast at load time.
 */
public class ConfigurationException extends NowQueueException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
