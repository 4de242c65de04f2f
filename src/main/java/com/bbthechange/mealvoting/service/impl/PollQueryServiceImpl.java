package com.bbthechange.mealvoting.service.impl;

import com.bbthechange.mealvoting.dto.*;
import com.bbthechange.mealvoting.model.ChainId;
import com.bbthechange.mealvoting.model.PollState;
import com.bbthechange.mealvoting.model.ResultEntry;
import com.bbthechange.mealvoting.service.PollChainRuntime;
import com.bbthechange.mealvoting.service.PollQueryService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class PollQueryServiceImpl implements PollQueryService {

    private final PollChainRuntime chainRuntime;

    @Autowired
    public PollQueryServiceImpl(PollChainRuntime chainRuntime) {
        this.chainRuntime = chainRuntime;
    }

    @Override
    public PollStateDTO getPoll(ChainId chainId) {
        PollState state = chainRuntime.getState(chainId);

        PollStateDTO dto = new PollStateDTO();
        dto.setChainId(chainId);
        dto.setTopic(state.getTopic());
        dto.setAdminId(state.getAdminId());
        dto.setVotesPerVoter(state.getVotesPerVoter());
        dto.setHasStarted(state.isHasStarted());
        dto.setClosed(state.isClosed());
        dto.setParticipants(toParticipantEntries(state));
        dto.setParticipantCount(state.getParticipants().size());
        dto.setNominations(toNominationEntries(state));
        dto.setRankings(toRankingEntries(state));
        dto.setResults(new ArrayList<>(state.getResults()));
        return dto;
    }

    @Override
    public List<ResultEntry> getResults(ChainId chainId) {
        return new ArrayList<>(chainRuntime.getState(chainId).getResults());
    }

    @Override
    public List<NominationEntry> getNominations(ChainId chainId) {
        return toNominationEntries(chainRuntime.getState(chainId));
    }

    @Override
    public ParticipantsDTO getParticipants(ChainId chainId) {
        PollState state = chainRuntime.getState(chainId);
        return new ParticipantsDTO(toParticipantEntries(state), state.getParticipants().size());
    }

    @Override
    public List<RankingEntry> getRankings(ChainId chainId) {
        return toRankingEntries(chainRuntime.getState(chainId));
    }

    @Override
    public List<ChainId> getCreatedPolls(ChainId chainId, String userId) {
        List<ChainId> created = chainRuntime.getState(chainId).getCreatedPolls().get(userId);
        return created != null ? new ArrayList<>(created) : List.of();
    }

    private List<ParticipantEntry> toParticipantEntries(PollState state) {
        return state.getParticipants().entrySet().stream()
            .map(entry -> new ParticipantEntry(entry.getKey(), entry.getValue()))
            .collect(Collectors.toList());
    }

    private List<NominationEntry> toNominationEntries(PollState state) {
        return state.getNominations().entrySet().stream()
            .map(entry -> new NominationEntry(entry.getKey(), entry.getValue().getUserId(), entry.getValue().getText()))
            .collect(Collectors.toList());
    }

    private List<RankingEntry> toRankingEntries(PollState state) {
        return state.getRankings().entrySet().stream()
            .map(entry -> new RankingEntry(entry.getKey(), new ArrayList<>(entry.getValue())))
            .collect(Collectors.toList());
    }
}
