package com.bbthechange.mealvoting.dto.message;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public class NominateMessage extends PollMessage {

    public static final String TYPE = "NOMINATE";

    @NotBlank(message = "User id is required")
    private String userId;

    @NotBlank(message = "Nomination text is required")
    @Size(max = 200, message = "Nomination text cannot exceed 200 characters")
    private String text;

    public NominateMessage() {
        super(TYPE);
    }

    public NominateMessage(String userId, String text) {
        super(TYPE);
        this.userId = userId;
        this.text = text;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    @Override
    public String toString() {
        return "NominateMessage{" +
                "userId='" + userId + '\'' +
                ", text='" + text + '\'' +
                ", messageId='" + getMessageId() + '\'' +
                '}';
    }
}
