package com.bbthechange.mealvoting.repository.impl;

import com.bbthechange.mealvoting.model.ChainDescription;
import com.bbthechange.mealvoting.model.ChainId;
import com.bbthechange.mealvoting.repository.ChainRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
public class InMemoryChainRepository implements ChainRepository {

    private final Map<ChainId, ChainDescription> chains = new ConcurrentHashMap<>();

    @Override
    public ChainDescription save(ChainDescription description) {
        chains.put(description.getChainId(), description);
        return description;
    }

    @Override
    public Optional<ChainDescription> findById(ChainId chainId) {
        return Optional.ofNullable(chains.get(chainId));
    }

    @Override
    public List<ChainDescription> findByOwner(String owner) {
        return chains.values().stream()
            .filter(chain -> owner.equals(chain.getOwner()))
            .sorted(Comparator.comparing(ChainDescription::getCreatedAt))
            .collect(Collectors.toList());
    }

    @Override
    public long count() {
        return chains.size();
    }
}
