package com.bbthechange.mealvoting.dto.operation;

/**
 * Join the poll, or change the display name of an existing participant.
 */
public class JoinOperation extends PollOperation {

    public static final String TYPE = "JOIN";

    private String name;

    public JoinOperation() {
        super(TYPE, null);
    }

    public JoinOperation(String name, String owner) {
        super(TYPE, owner);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        return "JoinOperation{" +
                "name='" + name + '\'' +
                ", owner='" + getOwner() + '\'' +
                '}';
    }
}
