package com.bbthechange.mealvoting.service;

import com.bbthechange.mealvoting.model.Nomination;
import com.bbthechange.mealvoting.model.PollState;
import com.bbthechange.mealvoting.model.ResultEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Borda-style scoring of ranked votes.
 *
 * A nomination ranked at index i earns max(votesPerVoter - i, 0) points.
 * Results are ordered by score descending; ties keep ascending nomination id order.
 */
@Component
public class TallyEngine {

    public static final String UNKNOWN_NOMINATION_TEXT = "Unknown";

    public List<ResultEntry> computeResults(PollState state) {
        long maxVotes = state.getVotesPerVoter();

        // Keyed by nomination id so iteration below is in ascending id order
        TreeMap<String, Long> scores = new TreeMap<>();
        for (List<String> ranking : state.getRankings().values()) {
            for (int rank = 0; rank < ranking.size(); rank++) {
                scores.merge(ranking.get(rank), pointsFor(maxVotes, rank), Long::sum);
            }
        }

        List<ResultEntry> results = new ArrayList<>(scores.size());
        for (Map.Entry<String, Long> entry : scores.entrySet()) {
            Nomination nomination = state.getNominations().get(entry.getKey());
            String text = nomination != null ? nomination.getText() : UNKNOWN_NOMINATION_TEXT;
            results.add(new ResultEntry(entry.getKey(), text, entry.getValue()));
        }

        // List.sort is stable
        results.sort(Comparator.comparingLong(ResultEntry::getScore).reversed());
        return results;
    }

    static long pointsFor(long votesPerVoter, int rank) {
        return Math.max(votesPerVoter - rank, 0L);
    }
}
