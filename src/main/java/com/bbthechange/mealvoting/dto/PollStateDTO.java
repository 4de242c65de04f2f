package com.bbthechange.mealvoting.dto;

import com.bbthechange.mealvoting.model.ChainId;
import com.bbthechange.mealvoting.model.ResultEntry;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Full read-only view of one poll chain.
 */
@Data
@NoArgsConstructor
public class PollStateDTO {
    private ChainId chainId;
    private String topic;
    private String adminId;
    private long votesPerVoter;
    private boolean hasStarted;
    @JsonProperty("isClosed")
    private boolean closed;
    private List<ParticipantEntry> participants = new ArrayList<>();
    private int participantCount;
    private List<NominationEntry> nominations = new ArrayList<>();
    private List<RankingEntry> rankings = new ArrayList<>();
    private List<ResultEntry> results = new ArrayList<>();
}
