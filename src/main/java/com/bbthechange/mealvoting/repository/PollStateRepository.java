package com.bbthechange.mealvoting.repository;

import com.bbthechange.mealvoting.model.ChainId;
import com.bbthechange.mealvoting.model.PollState;

import java.util.Optional;

/**
 * Repository interface for the per-chain poll state.
 * Loads hand out a private copy; saves replace the stored state wholesale.
 */
public interface PollStateRepository {

    /**
     * Load a copy of the committed state of a chain.
     * @param chainId The chain
     * @return Optional containing the state if the chain has one
     */
    Optional<PollState> load(ChainId chainId);

    /**
     * Commit the state of a chain.
     * @param chainId The chain
     * @param state The state to store
     */
    void save(ChainId chainId, PollState state);
}
