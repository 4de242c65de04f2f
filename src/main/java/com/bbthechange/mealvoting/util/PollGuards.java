package com.bbthechange.mealvoting.util;

import com.bbthechange.mealvoting.exception.PollError;
import com.bbthechange.mealvoting.exception.PollOperationException;
import com.bbthechange.mealvoting.model.PollState;

import java.util.List;

/**
 * Identity and phase checks over a poll's state.
 * The {@code is*} methods are pure predicates; the {@code require*} methods
 * throw {@link PollOperationException} with the matching error kind.
 */
public final class PollGuards {

    private PollGuards() {
        throw new UnsupportedOperationException("Utility class");
    }

    // Predicates

    public static boolean isAdmin(PollState state, String userId) {
        return userId != null && userId.equals(state.getAdminId());
    }

    public static boolean isParticipant(PollState state, String userId) {
        return userId != null && state.getParticipants().containsKey(userId);
    }

    public static boolean isVotingStarted(PollState state) {
        return state.isHasStarted();
    }

    public static boolean isClosed(PollState state) {
        return state.isClosed();
    }

    public static boolean exceedsVotesPerVoter(PollState state, List<String> rankings) {
        return rankings.size() > state.getVotesPerVoter();
    }

    public static boolean hasBlankEntry(List<String> rankings) {
        return rankings.stream().anyMatch(id -> id == null || id.isBlank());
    }

    // Guards

    public static void requireAdmin(PollState state, String userId, String action) {
        if (!isAdmin(state, userId)) {
            throw new PollOperationException(PollError.NOT_ADMIN, "Only admin can " + action);
        }
    }

    public static void requireParticipant(PollState state, String userId) {
        if (!isParticipant(state, userId)) {
            throw new PollOperationException(PollError.NOT_A_PARTICIPANT);
        }
    }

    public static void requireOpen(PollState state) {
        if (isClosed(state)) {
            throw new PollOperationException(PollError.POLL_CLOSED);
        }
    }

    public static void requireNotYetClosed(PollState state) {
        if (isClosed(state)) {
            throw new PollOperationException(PollError.ALREADY_CLOSED);
        }
    }

    public static void requireVotingNotStarted(PollState state) {
        if (isVotingStarted(state)) {
            throw new PollOperationException(PollError.VOTING_ALREADY_STARTED);
        }
    }

    public static void requireVotingStarted(PollState state) {
        if (!isVotingStarted(state)) {
            throw new PollOperationException(PollError.VOTING_NOT_STARTED);
        }
    }

    public static void requireWithinVotesPerVoter(PollState state, List<String> rankings) {
        if (exceedsVotesPerVoter(state, rankings)) {
            throw new PollOperationException(PollError.TOO_MANY_RANKINGS,
                "Too many rankings. Max allowed: " + state.getVotesPerVoter());
        }
    }

    public static void requireWellFormedRankings(List<String> rankings) {
        if (hasBlankEntry(rankings)) {
            throw new PollOperationException(PollError.INVALID_RANKING);
        }
    }
}
