package com.bbthechange.mealvoting.service;

import com.bbthechange.mealvoting.dto.message.ClosePollMessage;
import com.bbthechange.mealvoting.dto.message.InitializePollMessage;
import com.bbthechange.mealvoting.dto.message.NominateMessage;
import com.bbthechange.mealvoting.dto.message.PollMessage;
import com.bbthechange.mealvoting.dto.message.StartVoteMessage;
import com.bbthechange.mealvoting.dto.message.VoteMessage;
import com.bbthechange.mealvoting.dto.operation.ClosePollOperation;
import com.bbthechange.mealvoting.dto.operation.CreatePollOperation;
import com.bbthechange.mealvoting.dto.operation.JoinOperation;
import com.bbthechange.mealvoting.dto.operation.NominateOperation;
import com.bbthechange.mealvoting.dto.operation.PollOperation;
import com.bbthechange.mealvoting.dto.operation.StartVoteOperation;
import com.bbthechange.mealvoting.dto.operation.VoteOperation;
import com.bbthechange.mealvoting.model.Nomination;
import com.bbthechange.mealvoting.model.PollState;
import com.bbthechange.mealvoting.model.ResultEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.bbthechange.mealvoting.util.PollGuards.*;

/**
 * The poll state machine. Operations and their mirrored messages go through
 * the same validation and mutation methods below.
 *
 * Every method validates fully before mutating. A rejected call throws
 * {@link com.bbthechange.mealvoting.exception.PollOperationException} and the
 * runtime discards the working copy of the state.
 */
@Component
public class PollContract {

    private static final Logger logger = LoggerFactory.getLogger(PollContract.class);

    private final PollFactory pollFactory;
    private final TallyEngine tallyEngine;

    @Autowired
    public PollContract(PollFactory pollFactory, TallyEngine tallyEngine) {
        this.pollFactory = pollFactory;
        this.tallyEngine = tallyEngine;
    }

    public void executeOperation(PollState state, ChainRuntime runtime, PollOperation operation) {
        logger.debug("Executing operation on chain {}: {}", runtime.chainId(), operation);

        switch (operation.getType()) {
            case CreatePollOperation.TYPE ->
                pollFactory.createPoll(state, runtime, (CreatePollOperation) operation);
            case JoinOperation.TYPE -> {
                JoinOperation join = (JoinOperation) operation;
                join(state, join.getOwner(), join.getName());
            }
            case NominateOperation.TYPE -> {
                NominateOperation nominate = (NominateOperation) operation;
                nominate(state, nominate.getOwner(), nominate.getText());
            }
            case VoteOperation.TYPE -> {
                VoteOperation vote = (VoteOperation) operation;
                vote(state, vote.getOwner(), vote.getRankings());
            }
            case StartVoteOperation.TYPE -> startVote(state, operation.getOwner());
            case ClosePollOperation.TYPE -> closePoll(state, operation.getOwner());
            default -> throw new IllegalArgumentException("Unknown operation type: " + operation.getType());
        }
    }

    public void executeMessage(PollState state, ChainRuntime runtime, PollMessage message) {
        logger.debug("Executing message on chain {}: {}", runtime.chainId(), message);

        switch (message.getType()) {
            case InitializePollMessage.TYPE ->
                pollFactory.initializePoll(state, (InitializePollMessage) message);
            case NominateMessage.TYPE -> {
                NominateMessage nominate = (NominateMessage) message;
                nominate(state, nominate.getUserId(), nominate.getText());
            }
            case VoteMessage.TYPE -> {
                VoteMessage vote = (VoteMessage) message;
                vote(state, vote.getUserId(), vote.getRankings());
            }
            case StartVoteMessage.TYPE -> startVote(state, ((StartVoteMessage) message).getUserId());
            case ClosePollMessage.TYPE -> closePoll(state, ((ClosePollMessage) message).getUserId());
            default -> throw new IllegalArgumentException("Unknown message type: " + message.getType());
        }
    }

    /**
     * Only a closed poll refuses joins; joining during voting is allowed.
     * Joining again overwrites the display name.
     */
    void join(PollState state, String userId, String name) {
        requireOpen(state);
        state.getParticipants().put(userId, name);
        logger.debug("User {} joined as '{}'", userId, name);
    }

    /**
     * Only the voting phase is checked, not closure: a poll closed before
     * voting started still accepts nominations.
     */
    void nominate(PollState state, String userId, String text) {
        requireVotingNotStarted(state);
        requireParticipant(state, userId);

        String nominationId = state.nextNominationId();
        state.getNominations().put(nominationId, new Nomination(userId, text));
        logger.debug("User {} nominated '{}' as {}", userId, text, nominationId);
    }

    void vote(PollState state, String userId, List<String> rankings) {
        List<String> ranking = rankings != null ? rankings : List.of();

        requireVotingStarted(state);
        requireOpen(state);
        requireWithinVotesPerVoter(state, ranking);
        requireWellFormedRankings(ranking);
        requireParticipant(state, userId);

        state.getRankings().put(userId, new ArrayList<>(ranking));
        logger.debug("User {} ranked {}", userId, ranking);
    }

    void startVote(PollState state, String userId) {
        requireAdmin(state, userId, "start voting");
        if (state.isHasStarted()) {
            logger.debug("Voting already started, nothing to do");
            return;
        }
        state.setHasStarted(true);
        logger.info("Voting started on poll '{}'", state.getTopic());
    }

    /**
     * Closing does not require voting to have started.
     */
    void closePoll(PollState state, String userId) {
        requireAdmin(state, userId, "close the poll");
        requireNotYetClosed(state);

        state.setClosed(true);
        List<ResultEntry> results = tallyEngine.computeResults(state);
        state.setResults(results);
        logger.info("Closed poll '{}' with {} ranked nominations from {} voters",
            state.getTopic(), results.size(), state.getRankings().size());
    }
}
