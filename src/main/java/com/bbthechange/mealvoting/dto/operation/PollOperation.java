package com.bbthechange.mealvoting.dto.operation;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Base class for operations executed directly on the chain a caller is routed to.
 * Every operation carries the acting user's id as {@code owner}.
 * Uses Jackson polymorphic type handling for deserialization.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.EXISTING_PROPERTY,
    property = "type",
    visible = true
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = CreatePollOperation.class, name = CreatePollOperation.TYPE),
    @JsonSubTypes.Type(value = JoinOperation.class, name = JoinOperation.TYPE),
    @JsonSubTypes.Type(value = NominateOperation.class, name = NominateOperation.TYPE),
    @JsonSubTypes.Type(value = VoteOperation.class, name = VoteOperation.TYPE),
    @JsonSubTypes.Type(value = StartVoteOperation.class, name = StartVoteOperation.TYPE),
    @JsonSubTypes.Type(value = ClosePollOperation.class, name = ClosePollOperation.TYPE)
})
public abstract class PollOperation {

    private String type;
    private String owner;

    public PollOperation() {}

    public PollOperation(String type, String owner) {
        this.type = type;
        this.owner = owner;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }
}
