package com.bbthechange.mealvoting.exception;

import org.springframework.http.HttpStatus;

/**
 * Reasons an operation or message can be rejected by a poll chain.
 */
public enum PollError {
    AUTHENTICATION_MISSING(HttpStatus.UNAUTHORIZED, "Needs authenticated signer to create poll"),
    POLL_CLOSED(HttpStatus.CONFLICT, "Poll is closed"),
    VOTING_ALREADY_STARTED(HttpStatus.CONFLICT, "Cannot nominate after voting has started"),
    VOTING_NOT_STARTED(HttpStatus.CONFLICT, "Voting has not started yet"),
    NOT_A_PARTICIPANT(HttpStatus.FORBIDDEN, "User not in poll"),
    TOO_MANY_RANKINGS(HttpStatus.BAD_REQUEST, "Too many rankings"),
    INVALID_RANKING(HttpStatus.BAD_REQUEST, "Rankings must be non-blank nomination ids"),
    NOT_ADMIN(HttpStatus.FORBIDDEN, "Only admin can perform this action"),
    ALREADY_CLOSED(HttpStatus.CONFLICT, "Poll is already closed");

    private final HttpStatus httpStatus;
    private final String defaultMessage;

    PollError(HttpStatus httpStatus, String defaultMessage) {
        this.httpStatus = httpStatus;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    /**
     * Tag value used for metrics, e.g. "not_admin".
     */
    public String metricTag() {
        return name().toLowerCase();
    }
}
