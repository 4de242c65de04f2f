package com.bbthechange.mealvoting.dto.operation;

import java.util.ArrayList;
import java.util.List;

/**
 * Submit a ranking of nomination ids, first choice first.
 * Replaces any ranking the owner submitted before.
 */
public class VoteOperation extends PollOperation {

    public static final String TYPE = "VOTE";

    private List<String> rankings = new ArrayList<>();

    public VoteOperation() {
        super(TYPE, null);
    }

    public VoteOperation(List<String> rankings, String owner) {
        super(TYPE, owner);
        this.rankings = rankings;
    }

    public List<String> getRankings() {
        return rankings;
    }

    public void setRankings(List<String> rankings) {
        this.rankings = rankings;
    }

    @Override
    public String toString() {
        return "VoteOperation{" +
                "rankings=" + rankings +
                ", owner='" + getOwner() + '\'' +
                '}';
    }
}
