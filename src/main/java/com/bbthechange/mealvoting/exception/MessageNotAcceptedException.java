package com.bbthechange.mealvoting.exception;

/**
 * Exception thrown when a message type may not be delivered from outside the runtime.
 *
 * For example, InitializePoll, which only poll creation sends.
 */
public class MessageNotAcceptedException extends RuntimeException {

    public MessageNotAcceptedException(String message) {
        super(message);
    }
}
