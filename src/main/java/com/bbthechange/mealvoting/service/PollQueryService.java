package com.bbthechange.mealvoting.service;

import com.bbthechange.mealvoting.dto.NominationEntry;
import com.bbthechange.mealvoting.dto.ParticipantsDTO;
import com.bbthechange.mealvoting.dto.PollStateDTO;
import com.bbthechange.mealvoting.dto.RankingEntry;
import com.bbthechange.mealvoting.model.ChainId;
import com.bbthechange.mealvoting.model.ResultEntry;

import java.util.List;

/**
 * Read-only views over the committed state of a poll chain.
 */
public interface PollQueryService {

    PollStateDTO getPoll(ChainId chainId);

    /**
     * Final tally, empty until the poll is closed.
     */
    List<ResultEntry> getResults(ChainId chainId);

    /**
     * Nominations in nomination id order.
     */
    List<NominationEntry> getNominations(ChainId chainId);

    ParticipantsDTO getParticipants(ChainId chainId);

    List<RankingEntry> getRankings(ChainId chainId);

    /**
     * Poll chains created by a user through CreatePoll calls on this chain.
     */
    List<ChainId> getCreatedPolls(ChainId chainId, String userId);
}
