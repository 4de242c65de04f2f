package com.bbthechange.mealvoting.dto.operation;

public class ClosePollOperation extends PollOperation {

    public static final String TYPE = "CLOSE_POLL";

    public ClosePollOperation() {
        super(TYPE, null);
    }

    public ClosePollOperation(String owner) {
        super(TYPE, owner);
    }

    @Override
    public String toString() {
        return "ClosePollOperation{owner='" + getOwner() + "'}";
    }
}
