package com.bbthechange.mealvoting.exception;

/**
 * Exception thrown when the chain runtime cannot complete a call,
 * e.g. the worker was interrupted or the call timed out.
 * Wraps lower-level concurrency exceptions with meaningful messages.
 */
public class ChainExecutionException extends RuntimeException {

    public ChainExecutionException(String message) {
        super(message);
    }

    public ChainExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
