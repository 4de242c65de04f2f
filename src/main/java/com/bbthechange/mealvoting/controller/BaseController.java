package com.bbthechange.mealvoting.controller;

import com.bbthechange.mealvoting.config.SignerFilter;
import com.bbthechange.mealvoting.exception.ChainNotFoundException;
import com.bbthechange.mealvoting.exception.MessageNotAcceptedException;
import com.bbthechange.mealvoting.exception.PollOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Base controller with signer extraction and error handling shared by the poll endpoints.
 * Anything not handled here falls through to GlobalExceptionHandler.
 */
@RestController
public abstract class BaseController {

    private static final Logger logger = LoggerFactory.getLogger(BaseController.class);

    /**
     * Authenticated signer set by SignerFilter, or null for anonymous calls.
     * Only CreatePoll requires one; the contract decides.
     */
    protected String extractSigner(HttpServletRequest request) {
        Object signer = request.getAttribute(SignerFilter.SIGNER_ATTRIBUTE);
        if (!(signer instanceof String) || ((String) signer).isBlank()) {
            return null;
        }
        return (String) signer;
    }

    /**
     * Error response DTO for consistent error formatting.
     */
    public static class ErrorResponse {
        private final String error;
        private final String message;
        private final long timestamp;

        public ErrorResponse(String error, String message) {
            this.error = error;
            this.message = message;
            this.timestamp = System.currentTimeMillis();
        }

        public String getError() { return error; }
        public String getMessage() { return message; }
        public long getTimestamp() { return timestamp; }
    }

    @ExceptionHandler(PollOperationException.class)
    public ResponseEntity<ErrorResponse> handlePollOperation(PollOperationException e) {
        logger.warn("Poll operation rejected ({}): {}", e.getError(), e.getMessage());
        return ResponseEntity.status(e.getError().getHttpStatus())
            .body(new ErrorResponse(e.getError().name(), e.getMessage()));
    }

    @ExceptionHandler(ChainNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleChainNotFound(ChainNotFoundException e) {
        logger.debug("Chain not found: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse("CHAIN_NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(MessageNotAcceptedException.class)
    public ResponseEntity<ErrorResponse> handleMessageNotAccepted(MessageNotAcceptedException e) {
        logger.warn("Message not accepted: {}", e.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("MESSAGE_NOT_ACCEPTED", e.getMessage()));
    }

    @ExceptionHandler(jakarta.validation.ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(jakarta.validation.ConstraintViolationException e) {
        logger.warn("Validation constraint violation: {}", e.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("VALIDATION_ERROR", "Invalid input parameters"));
    }

    @ExceptionHandler(org.springframework.web.bind.MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(org.springframework.web.bind.MethodArgumentNotValidException e) {
        logger.warn("Method argument validation error: {}", e.getMessage());
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .findFirst()
            .orElse("Invalid input");
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("VALIDATION_ERROR", message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        logger.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("VALIDATION_ERROR", "Malformed request body"));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        logger.warn("Missing request parameter: {}", e.getParameterName());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("VALIDATION_ERROR", e.getParameterName() + " is required"));
    }
}
