package com.nowqueue.exception;

/**
 * Base exception for the prioritization engine.
 */
public class NowQueueException extends RuntimeException {

    public NowQueueException(String message) {
        super(message);
    }

    public NowQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
