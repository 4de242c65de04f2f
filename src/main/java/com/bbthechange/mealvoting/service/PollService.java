package com.bbthechange.mealvoting.service;

import com.bbthechange.mealvoting.dto.*;
import com.bbthechange.mealvoting.dto.message.PollMessage;
import com.bbthechange.mealvoting.model.ChainId;

/**
 * Service interface for the mutating side of a poll.
 * Each method runs one operation on the given chain and throws
 * {@link com.bbthechange.mealvoting.exception.PollOperationException} if it is rejected.
 */
public interface PollService {

    /**
     * Create a new poll chain. Requires an authenticated signer.
     * The new chain is initialized asynchronously.
     */
    CreatePollResponse createPoll(ChainId chainId, CreatePollRequest request, String signer);

    /**
     * Join the poll, or rename an existing participant. Refused once the poll is closed.
     */
    void join(ChainId chainId, JoinRequest request, String signer);

    /**
     * Add a nomination. Participants only, before voting starts.
     */
    void nominate(ChainId chainId, NominateRequest request, String signer);

    /**
     * Submit or replace a ranking. Participants only, while voting is open.
     */
    void vote(ChainId chainId, VoteRequest request, String signer);

    /**
     * Start the voting phase (admin only).
     */
    void startVote(ChainId chainId, AdminActionRequest request, String signer);

    /**
     * Close the poll and compute results (admin only, once).
     */
    void closePoll(ChainId chainId, AdminActionRequest request, String signer);

    /**
     * Hand a message from another chain to the target chain's mailbox.
     */
    void deliverMessage(ChainId chainId, PollMessage message);
}
