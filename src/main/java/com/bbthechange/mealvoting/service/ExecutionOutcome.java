package com.bbthechange.mealvoting.service;

import com.bbthechange.mealvoting.exception.PollError;
import com.bbthechange.mealvoting.model.ChainId;

import java.util.List;

/**
 * Result of executing an operation on a chain: either every effect was
 * committed, or none was and the error says why.
 */
public class ExecutionOutcome {

    private final PollError error;
    private final String message;
    private final List<ChainId> openedChains;

    private ExecutionOutcome(PollError error, String message, List<ChainId> openedChains) {
        this.error = error;
        this.message = message;
        this.openedChains = openedChains;
    }

    public static ExecutionOutcome success(List<ChainId> openedChains) {
        return new ExecutionOutcome(null, "Operation committed", List.copyOf(openedChains));
    }

    public static ExecutionOutcome failure(PollError error, String message) {
        return new ExecutionOutcome(error, message, List.of());
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Error kind of a failed call, null on success.
     */
    public PollError getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Chains opened by the call (CreatePoll opens exactly one).
     */
    public List<ChainId> getOpenedChains() {
        return openedChains;
    }

    @Override
    public String toString() {
        return "ExecutionOutcome{" +
                "error=" + error +
                ", message='" + message + '\'' +
                ", openedChains=" + openedChains +
                '}';
    }
}
