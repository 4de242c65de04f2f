package com.bbthechange.mealvoting.dto.message;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Base class for one-way messages delivered to a specific poll chain.
 * Apart from InitializePoll, each message mirrors a local operation and is
 * validated the same way. The acting user is carried explicitly; the sender
 * is trusted to have authenticated it.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.EXISTING_PROPERTY,
    property = "type",
    visible = true
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = InitializePollMessage.class, name = InitializePollMessage.TYPE),
    @JsonSubTypes.Type(value = NominateMessage.class, name = NominateMessage.TYPE),
    @JsonSubTypes.Type(value = VoteMessage.class, name = VoteMessage.TYPE),
    @JsonSubTypes.Type(value = StartVoteMessage.class, name = StartVoteMessage.TYPE),
    @JsonSubTypes.Type(value = ClosePollMessage.class, name = ClosePollMessage.TYPE)
})
public abstract class PollMessage {

    private String type;
    private String messageId;

    public PollMessage() {}

    public PollMessage(String type) {
        this.type = type;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getMessageId() {
        return messageId;
    }

    public void setMessageId(String messageId) {
        this.messageId = messageId;
    }
}
