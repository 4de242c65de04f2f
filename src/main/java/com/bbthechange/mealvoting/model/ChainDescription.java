package com.bbthechange.mealvoting.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Bookkeeping for an opened chain: who owns it and what it was funded with.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChainDescription {
    private ChainId chainId;
    private String owner;           // Sole owner (the authenticated signer that opened it)
    private BigDecimal balance;
    private ChainId parentChainId;  // null for the root chain
    private Instant createdAt;
}
