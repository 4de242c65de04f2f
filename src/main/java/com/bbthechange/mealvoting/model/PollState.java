package com.bbthechange.mealvoting.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * State owned by a single poll chain.
 *
 * Scalar registers (topic, votesPerVoter, adminId, hasStarted, isClosed, results)
 * plus three key-ordered maps (participants, nominations, rankings). The
 * createdPolls map belongs to the factory concern: it records the chains
 * spawned by CreatePoll calls executed on this chain.
 *
 * Instances are mutated only by the chain's worker. The repository hands out
 * copies, so a call that fails leaves the stored state untouched.
 */
public class PollState {

    public static final String NOMINATION_ID_PREFIX = "nom_";

    private String topic = "";
    private long votesPerVoter;
    private String adminId = "";
    private boolean hasStarted;
    private boolean isClosed;
    private List<ResultEntry> results = new ArrayList<>();

    private final TreeMap<String, String> participants = new TreeMap<>();
    private final TreeMap<String, Nomination> nominations = new TreeMap<>();
    private final TreeMap<String, List<String>> rankings = new TreeMap<>();
    private final TreeMap<String, List<ChainId>> createdPolls = new TreeMap<>();

    public PollState() {
    }

    /**
     * Deep copy, used for load-at-call-start / persist-at-call-end.
     */
    public PollState copy() {
        PollState copy = new PollState();
        copy.topic = topic;
        copy.votesPerVoter = votesPerVoter;
        copy.adminId = adminId;
        copy.hasStarted = hasStarted;
        copy.isClosed = isClosed;
        for (ResultEntry entry : results) {
            copy.results.add(new ResultEntry(entry.getNominationId(), entry.getNominationText(), entry.getScore()));
        }
        copy.participants.putAll(participants);
        nominations.forEach((id, nomination) ->
            copy.nominations.put(id, new Nomination(nomination.getUserId(), nomination.getText())));
        rankings.forEach((userId, ranking) -> copy.rankings.put(userId, new ArrayList<>(ranking)));
        createdPolls.forEach((userId, chains) -> copy.createdPolls.put(userId, new ArrayList<>(chains)));
        return copy;
    }

    /**
     * Id the next nomination will get: "nom_" followed by the current nomination count.
     */
    public String nextNominationId() {
        return NOMINATION_ID_PREFIX + nominations.size();
    }

    public String getTopic() {
        return topic;
    }

    public void setTopic(String topic) {
        this.topic = topic;
    }

    public long getVotesPerVoter() {
        return votesPerVoter;
    }

    public void setVotesPerVoter(long votesPerVoter) {
        this.votesPerVoter = votesPerVoter;
    }

    public String getAdminId() {
        return adminId;
    }

    public void setAdminId(String adminId) {
        this.adminId = adminId;
    }

    public boolean isHasStarted() {
        return hasStarted;
    }

    public void setHasStarted(boolean hasStarted) {
        this.hasStarted = hasStarted;
    }

    public boolean isClosed() {
        return isClosed;
    }

    public void setClosed(boolean closed) {
        this.isClosed = closed;
    }

    public List<ResultEntry> getResults() {
        return Collections.unmodifiableList(results);
    }

    public void setResults(List<ResultEntry> results) {
        this.results = new ArrayList<>(results);
    }

    public Map<String, String> getParticipants() {
        return participants;
    }

    public Map<String, Nomination> getNominations() {
        return nominations;
    }

    public Map<String, List<String>> getRankings() {
        return rankings;
    }

    public Map<String, List<ChainId>> getCreatedPolls() {
        return createdPolls;
    }
}
