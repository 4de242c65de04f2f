package com.bbthechange.mealvoting.dto.message;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Sent by CreatePoll to the freshly opened chain.
 * Sets topic, votes per voter and admin, and joins the admin as "Admin".
 */
public class InitializePollMessage extends PollMessage {

    public static final String TYPE = "INITIALIZE_POLL";

    @NotBlank(message = "Poll topic is required")
    private String topic;

    @Min(value = 0, message = "Votes per voter cannot be negative")
    @Max(value = 4294967295L, message = "Votes per voter is too large")
    private long votesPerVoter;

    @NotBlank(message = "Admin id is required")
    private String adminId;

    public InitializePollMessage() {
        super(TYPE);
    }

    public InitializePollMessage(String topic, long votesPerVoter, String adminId) {
        super(TYPE);
        this.topic = topic;
        this.votesPerVoter = votesPerVoter;
        this.adminId = adminId;
    }

    public String getTopic() {
        return topic;
    }

    public void setTopic(String topic) {
        this.topic = topic;
    }

    public long getVotesPerVoter() {
        return votesPerVoter;
    }

    public void setVotesPerVoter(long votesPerVoter) {
        this.votesPerVoter = votesPerVoter;
    }

    public String getAdminId() {
        return adminId;
    }

    public void setAdminId(String adminId) {
        this.adminId = adminId;
    }

    @Override
    public String toString() {
        return "InitializePollMessage{" +
                "topic='" + topic + '\'' +
                ", votesPerVoter=" + votesPerVoter +
                ", adminId='" + adminId + '\'' +
                ", messageId='" + getMessageId() + '\'' +
                '}';
    }
}
