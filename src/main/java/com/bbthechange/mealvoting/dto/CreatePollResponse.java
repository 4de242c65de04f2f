package com.bbthechange.mealvoting.dto;

import com.bbthechange.mealvoting.model.ChainId;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreatePollResponse {
    private ChainId chainId;        // The new poll chain
    private ChainId creatorChainId; // Chain where the creation was recorded
    private String topic;
}
