package com.bbthechange.mealvoting.repository.impl;

import com.bbthechange.mealvoting.model.ChainId;
import com.bbthechange.mealvoting.model.PollState;
import com.bbthechange.mealvoting.repository.PollStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Implementation of PollStateRepository keeping committed state in memory.
 * Stored objects are never handed out, only copies of them.
 */
@Repository
public class InMemoryPollStateRepository implements PollStateRepository {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryPollStateRepository.class);

    private final Map<ChainId, PollState> states = new ConcurrentHashMap<>();

    @Override
    public Optional<PollState> load(ChainId chainId) {
        PollState stored = states.get(chainId);
        return stored != null ? Optional.of(stored.copy()) : Optional.empty();
    }

    @Override
    public void save(ChainId chainId, PollState state) {
        states.put(chainId, state.copy());
        logger.debug("Committed state for chain {}", chainId);
    }
}
