package com.bbthechange.mealvoting.service;

import com.bbthechange.mealvoting.dto.message.PollMessage;
import com.bbthechange.mealvoting.dto.operation.PollOperation;
import com.bbthechange.mealvoting.model.ChainDescription;
import com.bbthechange.mealvoting.model.ChainId;
import com.bbthechange.mealvoting.model.PollState;

import java.util.List;

/**
 * Hosts poll chains. Calls targeting one chain run one at a time, in
 * arrival order, each to completion; calls on different chains are independent.
 */
public interface PollChainRuntime {

    /**
     * The chain opened at startup, on which callers without a poll of their
     * own can run CreatePoll.
     */
    ChainId getRootChainId();

    /**
     * Execute an operation on a chain and wait for it to commit or fail.
     *
     * @param chainId The target chain
     * @param signer The authenticated signer, or null if the caller is anonymous
     * @param operation The operation
     * @throws com.bbthechange.mealvoting.exception.ChainNotFoundException if the chain does not exist
     */
    ExecutionOutcome execute(ChainId chainId, String signer, PollOperation operation);

    /**
     * Queue a message for a chain and return without waiting for it to run.
     *
     * @throws com.bbthechange.mealvoting.exception.ChainNotFoundException if the chain does not exist
     */
    void deliver(ChainId chainId, PollMessage message);

    /**
     * Block until everything queued so far on the chain has run.
     */
    void awaitIdle(ChainId chainId);

    /**
     * Copy of the committed state of a chain.
     */
    PollState getState(ChainId chainId);

    ChainDescription getChain(ChainId chainId);

    List<ChainDescription> getChainsOwnedBy(String owner);
}
