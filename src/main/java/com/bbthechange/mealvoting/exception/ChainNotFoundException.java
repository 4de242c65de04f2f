package com.bbthechange.mealvoting.exception;

/**
 * Exception thrown when a chain id does not refer to an opened chain.
 */
public class ChainNotFoundException extends RuntimeException {

    public ChainNotFoundException(String message) {
        super(message);
    }

    public ChainNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
