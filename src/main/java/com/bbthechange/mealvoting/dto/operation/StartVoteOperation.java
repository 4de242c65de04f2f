package com.bbthechange.mealvoting.dto.operation;

public class StartVoteOperation extends PollOperation {

    public static final String TYPE = "START_VOTE";

    public StartVoteOperation() {
        super(TYPE, null);
    }

    public StartVoteOperation(String owner) {
        super(TYPE, owner);
    }

    @Override
    public String toString() {
        return "StartVoteOperation{owner='" + getOwner() + "'}";
    }
}
