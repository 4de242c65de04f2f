package com.bbthechange.mealvoting.service;

import com.bbthechange.mealvoting.config.PollProperties;
import com.bbthechange.mealvoting.dto.message.InitializePollMessage;
import com.bbthechange.mealvoting.dto.operation.CreatePollOperation;
import com.bbthechange.mealvoting.exception.PollError;
import com.bbthechange.mealvoting.exception.PollOperationException;
import com.bbthechange.mealvoting.model.ChainId;
import com.bbthechange.mealvoting.model.PollState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

/**
 * Creation side of a poll: spawning a chain for it and initializing that chain.
 */
@Component
public class PollFactory {

    private static final Logger logger = LoggerFactory.getLogger(PollFactory.class);

    public static final String ADMIN_DISPLAY_NAME = "Admin";

    private final PollProperties pollProperties;

    @Autowired
    public PollFactory(PollProperties pollProperties) {
        this.pollProperties = pollProperties;
    }

    /**
     * Open a chain owned by the signer, send it the initialization message and
     * record it against the creator in this chain's createdPolls.
     *
     * @return id of the new poll chain
     */
    public ChainId createPoll(PollState state, ChainRuntime runtime, CreatePollOperation operation) {
        String signer = runtime.authenticatedSigner()
            .orElseThrow(() -> new PollOperationException(PollError.AUTHENTICATION_MISSING));
        String creatorId = operation.getOwner();

        ChainId pollChainId = runtime.openChain(signer, pollProperties.getChain().getInitialBalance());

        InitializePollMessage message = new InitializePollMessage(
            operation.getTopic(), operation.getVotesPerVoter(), creatorId);
        runtime.sendMessage(pollChainId, message);

        state.getCreatedPolls().computeIfAbsent(creatorId, k -> new ArrayList<>()).add(pollChainId);

        logger.info("User {} created poll '{}' on chain {} (votesPerVoter={})",
            creatorId, operation.getTopic(), pollChainId, operation.getVotesPerVoter());
        return pollChainId;
    }

    /**
     * Apply the initialization message. Assumed to be delivered exactly once;
     * a second delivery resets admin and phase flags.
     */
    public void initializePoll(PollState state, InitializePollMessage message) {
        if (!state.getAdminId().isEmpty()) {
            logger.warn("Re-initializing poll chain: admin {} replaced by {}", state.getAdminId(), message.getAdminId());
        }

        state.setTopic(message.getTopic());
        state.setVotesPerVoter(message.getVotesPerVoter());
        state.setAdminId(message.getAdminId());
        state.setHasStarted(false);
        state.setClosed(false);
        state.setResults(new ArrayList<>());
        state.getParticipants().put(message.getAdminId(), ADMIN_DISPLAY_NAME);

        logger.info("Initialized poll '{}' with admin {}", message.getTopic(), message.getAdminId());
    }
}
