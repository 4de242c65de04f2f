package com.bbthechange.mealvoting.service.impl;

import com.bbthechange.mealvoting.dto.*;
import com.bbthechange.mealvoting.dto.message.PollMessage;
import com.bbthechange.mealvoting.dto.operation.*;
import com.bbthechange.mealvoting.exception.ChainExecutionException;
import com.bbthechange.mealvoting.exception.PollOperationException;
import com.bbthechange.mealvoting.model.ChainId;
import com.bbthechange.mealvoting.service.ExecutionOutcome;
import com.bbthechange.mealvoting.service.PollChainRuntime;
import com.bbthechange.mealvoting.service.PollService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Implementation of PollService translating requests into chain operations.
 */
@Service
public class PollServiceImpl implements PollService {

    private static final Logger logger = LoggerFactory.getLogger(PollServiceImpl.class);

    private final PollChainRuntime chainRuntime;

    @Autowired
    public PollServiceImpl(PollChainRuntime chainRuntime) {
        this.chainRuntime = chainRuntime;
    }

    @Override
    public CreatePollResponse createPoll(ChainId chainId, CreatePollRequest request, String signer) {
        logger.info("Creating poll '{}' from chain {} for user {}", request.getTopic(), chainId, request.getOwner());

        CreatePollOperation operation = new CreatePollOperation(request.getTopic(), request.getVotesPerVoter(), request.getOwner());
        ExecutionOutcome outcome = execute(chainId, signer, operation);

        ChainId pollChainId = outcome.getOpenedChains().stream()
            .findFirst()
            .orElseThrow(() -> new ChainExecutionException("CreatePoll committed without opening a chain"));

        return new CreatePollResponse(pollChainId, chainId, request.getTopic());
    }

    @Override
    public void join(ChainId chainId, JoinRequest request, String signer) {
        execute(chainId, signer, new JoinOperation(request.getName(), request.getOwner()));
    }

    @Override
    public void nominate(ChainId chainId, NominateRequest request, String signer) {
        execute(chainId, signer, new NominateOperation(request.getText(), request.getOwner()));
    }

    @Override
    public void vote(ChainId chainId, VoteRequest request, String signer) {
        execute(chainId, signer, new VoteOperation(request.getRankings(), request.getOwner()));
    }

    @Override
    public void startVote(ChainId chainId, AdminActionRequest request, String signer) {
        execute(chainId, signer, new StartVoteOperation(request.getOwner()));
    }

    @Override
    public void closePoll(ChainId chainId, AdminActionRequest request, String signer) {
        execute(chainId, signer, new ClosePollOperation(request.getOwner()));
    }

    @Override
    public void deliverMessage(ChainId chainId, PollMessage message) {
        logger.debug("Delivering {} to chain {}", message.getType(), chainId);
        chainRuntime.deliver(chainId, message);
    }

    private ExecutionOutcome execute(ChainId chainId, String signer, PollOperation operation) {
        ExecutionOutcome outcome = chainRuntime.execute(chainId, signer, operation);
        if (!outcome.isSuccess()) {
            throw new PollOperationException(outcome.getError(), outcome.getMessage());
        }
        return outcome;
    }
}
