package com.bbthechange.mealvoting.repository;

import com.bbthechange.mealvoting.model.ChainDescription;
import com.bbthechange.mealvoting.model.ChainId;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for opened chains.
 */
public interface ChainRepository {

    ChainDescription save(ChainDescription description);

    Optional<ChainDescription> findById(ChainId chainId);

    /**
     * Find all chains owned by a signer, oldest first.
     */
    List<ChainDescription> findByOwner(String owner);

    long count();
}
