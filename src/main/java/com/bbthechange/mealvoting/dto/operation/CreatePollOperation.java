package com.bbthechange.mealvoting.dto.operation;

/**
 * Spawn a new poll chain owned by the signer and initialize it with this topic.
 */
public class CreatePollOperation extends PollOperation {

    public static final String TYPE = "CREATE_POLL";

    private String topic;
    private long votesPerVoter;

    public CreatePollOperation() {
        super(TYPE, null);
    }

    public CreatePollOperation(String topic, long votesPerVoter, String owner) {
        super(TYPE, owner);
        this.topic = topic;
        this.votesPerVoter = votesPerVoter;
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

    @Override
    public String toString() {
        return "CreatePollOperation{" +
                "topic='" + topic + '\'' +
                ", votesPerVoter=" + votesPerVoter +
                ", owner='" + getOwner() + '\'' +
                '}';
    }
}
