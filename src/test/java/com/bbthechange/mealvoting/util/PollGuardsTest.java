package com.bbthechange.mealvoting.util;

import com.bbthechange.mealvoting.exception.PollError;
import com.bbthechange.mealvoting.exception.PollOperationException;
import com.bbthechange.mealvoting.model.PollState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PollGuardsTest {

    private PollState state;

    @BeforeEach
    void setUp() {
        state = new PollState();
        state.setAdminId("alice");
        state.setVotesPerVoter(2);
        state.getParticipants().put("alice", "Admin");
    }

    @Test
    void isAdmin_MatchesOnlyAdminId() {
        assertThat(PollGuards.isAdmin(state, "alice")).isTrue();
        assertThat(PollGuards.isAdmin(state, "bob")).isFalse();
        assertThat(PollGuards.isAdmin(state, null)).isFalse();
    }

    @Test
    void isAdmin_UninitializedPoll_EmptyUserIsNotAdmin() {
        // Given
        PollState fresh = new PollState();

        // Then - empty admin id matches only an empty caller id
        assertThat(PollGuards.isAdmin(fresh, "alice")).isFalse();
    }

    @Test
    void isParticipant_ChecksParticipantKeys() {
        assertThat(PollGuards.isParticipant(state, "alice")).isTrue();
        assertThat(PollGuards.isParticipant(state, "bob")).isFalse();
        assertThat(PollGuards.isParticipant(state, null)).isFalse();
    }

    @Test
    void exceedsVotesPerVoter_BoundaryIsInclusive() {
        assertThat(PollGuards.exceedsVotesPerVoter(state, List.of("a", "b"))).isFalse();
        assertThat(PollGuards.exceedsVotesPerVoter(state, List.of("a", "b", "c"))).isTrue();
        assertThat(PollGuards.exceedsVotesPerVoter(state, List.of())).isFalse();
    }

    @Test
    void requireWellFormedRankings_NullOrBlankEntry_ThrowsInvalidRanking() {
        assertThatCode(() -> PollGuards.requireWellFormedRankings(List.of("nom_0", "nom_1"))).doesNotThrowAnyException();
        assertThatCode(() -> PollGuards.requireWellFormedRankings(List.of())).doesNotThrowAnyException();

        assertThatThrownBy(() -> PollGuards.requireWellFormedRankings(Arrays.asList("nom_0", null)))
            .extracting("error").isEqualTo(PollError.INVALID_RANKING);
        assertThatThrownBy(() -> PollGuards.requireWellFormedRankings(List.of("")))
            .extracting("error").isEqualTo(PollError.INVALID_RANKING);
    }

    @Test
    void requireAdmin_NonAdmin_ThrowsNotAdminWithAction() {
        assertThatThrownBy(() -> PollGuards.requireAdmin(state, "bob", "start voting"))
            .isInstanceOf(PollOperationException.class)
            .hasMessage("Only admin can start voting")
            .extracting("error").isEqualTo(PollError.NOT_ADMIN);
    }

    @Test
    void requireOpen_And_RequireNotYetClosed_UseDifferentKinds() {
        // Given
        state.setClosed(true);

        // When & Then
        assertThatThrownBy(() -> PollGuards.requireOpen(state))
            .extracting("error").isEqualTo(PollError.POLL_CLOSED);
        assertThatThrownBy(() -> PollGuards.requireNotYetClosed(state))
            .extracting("error").isEqualTo(PollError.ALREADY_CLOSED);
    }

    @Test
    void votingPhaseGuards_FollowHasStarted() {
        assertThatCode(() -> PollGuards.requireVotingNotStarted(state)).doesNotThrowAnyException();
        assertThatThrownBy(() -> PollGuards.requireVotingStarted(state))
            .extracting("error").isEqualTo(PollError.VOTING_NOT_STARTED);

        state.setHasStarted(true);

        assertThatCode(() -> PollGuards.requireVotingStarted(state)).doesNotThrowAnyException();
        assertThatThrownBy(() -> PollGuards.requireVotingNotStarted(state))
            .extracting("error").isEqualTo(PollError.VOTING_ALREADY_STARTED);
    }

    @Test
    void requireWithinVotesPerVoter_TooMany_MessageNamesLimit() {
        assertThatThrownBy(() -> PollGuards.requireWithinVotesPerVoter(state, List.of("a", "b", "c")))
            .isInstanceOf(PollOperationException.class)
            .hasMessage("Too many rankings. Max allowed: 2");
    }
}
