package com.bbthechange.mealvoting.dto.message;

import jakarta.validation.constraints.NotBlank;

public class ClosePollMessage extends PollMessage {

    public static final String TYPE = "CLOSE_POLL";

    @NotBlank(message = "User id is required")
    private String userId;

    public ClosePollMessage() {
        super(TYPE);
    }

    public ClosePollMessage(String userId) {
        super(TYPE);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    @Override
    public String toString() {
        return "ClosePollMessage{" +
                "userId='" + userId + '\'' +
                ", messageId='" + getMessageId() + '\'' +
                '}';
    }
}
