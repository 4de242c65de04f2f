package com.bbthechange.mealvoting.service;

import com.bbthechange.mealvoting.dto.message.PollMessage;
import com.bbthechange.mealvoting.model.ChainId;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * What the poll contract can ask of the hosting substrate during one call.
 * Chains opened and messages sent through this interface only take effect
 * if the call completes without error.
 */
public interface ChainRuntime {

    /**
     * The chain the current call is executing on.
     */
    ChainId chainId();

    /**
     * The signer that authenticated the current call, if any.
     * Always empty while a message is being executed.
     */
    Optional<String> authenticatedSigner();

    /**
     * Open a new chain with a single owner, funded with the given balance.
     *
     * @return the id of the new chain
     */
    ChainId openChain(String owner, BigDecimal initialBalance);

    /**
     * Queue a one-way message for delivery to another chain.
     * The sender never observes whether or how the message executes.
     */
    void sendMessage(ChainId target, PollMessage message);
}
