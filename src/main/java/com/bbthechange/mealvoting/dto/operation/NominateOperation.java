package com.bbthechange.mealvoting.dto.operation;

public class NominateOperation extends PollOperation {

    public static final String TYPE = "NOMINATE";

    private String text;

    public NominateOperation() {
        super(TYPE, null);
    }

    public NominateOperation(String text, String owner) {
        super(TYPE, owner);
        this.text = text;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    @Override
    public String toString() {
        return "NominateOperation{" +
                "text='" + text + '\'' +
                ", owner='" + getOwner() + '\'' +
                '}';
    }
}
