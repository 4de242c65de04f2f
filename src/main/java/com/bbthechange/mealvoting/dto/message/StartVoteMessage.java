package com.bbthechange.mealvoting.dto.message;

import jakarta.validation.constraints.NotBlank;

public class StartVoteMessage extends PollMessage {

    public static final String TYPE = "START_VOTE";

    @NotBlank(message = "User id is required")
    private String userId;

    public StartVoteMessage() {
        super(TYPE);
    }

    public StartVoteMessage(String userId) {
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
        return "StartVoteMessage{" +
                "userId='" + userId + '\'' +
                ", messageId='" + getMessageId() + '\'' +
                '}';
    }
}
