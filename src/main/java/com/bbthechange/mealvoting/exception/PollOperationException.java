package com.bbthechange.mealvoting.exception;

/**
 * Exception thrown when a poll operation or message fails validation.
 * The whole call is aborted and none of its state changes are kept.
 */
public class PollOperationException extends RuntimeException {

    private final PollError error;

    public PollOperationException(PollError error) {
        super(error.getDefaultMessage());
        this.error = error;
    }

    public PollOperationException(PollError error, String message) {
        super(message);
        this.error = error;
    }

    public PollError getError() {
        return error;
    }
}
