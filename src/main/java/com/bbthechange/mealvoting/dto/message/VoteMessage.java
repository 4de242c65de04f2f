package com.bbthechange.mealvoting.dto.message;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;

public class VoteMessage extends PollMessage {

    public static final String TYPE = "VOTE";

    @NotBlank(message = "User id is required")
    private String userId;

    @NotNull(message = "Rankings are required")
    private List<@NotBlank(message = "Ranked nomination ids cannot be blank") String> rankings = new ArrayList<>();

    public VoteMessage() {
        super(TYPE);
    }

    public VoteMessage(String userId, List<String> rankings) {
        super(TYPE);
        this.userId = userId;
        this.rankings = rankings;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public List<String> getRankings() {
        return rankings;
    }

    public void setRankings(List<String> rankings) {
        this.rankings = rankings;
    }

    @Override
    public String toString() {
        return "VoteMessage{" +
                "userId='" + userId + '\'' +
                ", rankings=" + rankings +
                ", messageId='" + getMessageId() + '\'' +
                '}';
    }
}
