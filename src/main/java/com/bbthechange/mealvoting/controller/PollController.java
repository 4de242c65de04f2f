package com.bbthechange.mealvoting.controller;

import com.bbthechange.mealvoting.dto.*;
import com.bbthechange.mealvoting.model.ChainId;
import com.bbthechange.mealvoting.model.ResultEntry;
import com.bbthechange.mealvoting.service.PollQueryService;
import com.bbthechange.mealvoting.service.PollService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.util.List;

/**
 * REST controller for the poll running on a chain.
 * Mutations run as operations on the chain; queries read its committed state.
 */
@RestController
@RequestMapping("/chains/{chainId}")
@Validated
@Tag(name = "Polls", description = "Ranked-choice poll on a chain")
public class PollController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(PollController.class);

    private static final String CHAIN_ID_REGEX = "[0-9a-f]{64}";
    private static final String CHAIN_ID_MESSAGE = "Invalid chain ID format";

    private final PollService pollService;
    private final PollQueryService pollQueryService;

    @Autowired
    public PollController(PollService pollService, PollQueryService pollQueryService) {
        this.pollService = pollService;
        this.pollQueryService = pollQueryService;
    }

    @PostMapping("/polls")
    @Operation(summary = "Create a new poll on its own chain")
    public ResponseEntity<CreatePollResponse> createPoll(
            @PathVariable @Pattern(regexp = CHAIN_ID_REGEX, message = CHAIN_ID_MESSAGE) String chainId,
            @Valid @RequestBody CreatePollRequest request,
            HttpServletRequest httpRequest) {

        CreatePollResponse response = pollService.createPoll(ChainId.of(chainId), request, extractSigner(httpRequest));
        logger.info("Created poll chain {} for '{}'", response.getChainId(), request.getTopic());

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/participants")
    @Operation(summary = "Join the poll")
    public ResponseEntity<Void> join(
            @PathVariable @Pattern(regexp = CHAIN_ID_REGEX, message = CHAIN_ID_MESSAGE) String chainId,
            @Valid @RequestBody JoinRequest request,
            HttpServletRequest httpRequest) {

        logger.info("User {} joining chain {} as '{}'", request.getOwner(), chainId, request.getName());
        pollService.join(ChainId.of(chainId), request, extractSigner(httpRequest));

        return ResponseEntity.noContent().build();
    }

    @PostMapping("/nominations")
    @Operation(summary = "Nominate an option (before voting starts)")
    public ResponseEntity<Void> nominate(
            @PathVariable @Pattern(regexp = CHAIN_ID_REGEX, message = CHAIN_ID_MESSAGE) String chainId,
            @Valid @RequestBody NominateRequest request,
            HttpServletRequest httpRequest) {

        logger.info("User {} nominating '{}' on chain {}", request.getOwner(), request.getText(), chainId);
        pollService.nominate(ChainId.of(chainId), request, extractSigner(httpRequest));

        return ResponseEntity.noContent().build();
    }

    @PostMapping("/votes")
    @Operation(summary = "Submit a ranking of nominations")
    public ResponseEntity<Void> vote(
            @PathVariable @Pattern(regexp = CHAIN_ID_REGEX, message = CHAIN_ID_MESSAGE) String chainId,
            @Valid @RequestBody VoteRequest request,
            HttpServletRequest httpRequest) {

        logger.info("User {} voting on chain {}", request.getOwner(), chainId);
        pollService.vote(ChainId.of(chainId), request, extractSigner(httpRequest));

        return ResponseEntity.noContent().build();
    }

    @PostMapping("/start")
    @Operation(summary = "Start the voting phase (admin only)")
    public ResponseEntity<Void> startVote(
            @PathVariable @Pattern(regexp = CHAIN_ID_REGEX, message = CHAIN_ID_MESSAGE) String chainId,
            @Valid @RequestBody AdminActionRequest request,
            HttpServletRequest httpRequest) {

        logger.info("User {} starting vote on chain {}", request.getOwner(), chainId);
        pollService.startVote(ChainId.of(chainId), request, extractSigner(httpRequest));

        return ResponseEntity.noContent().build();
    }

    @PostMapping("/close")
    @Operation(summary = "Close the poll and compute results (admin only)")
    public ResponseEntity<Void> closePoll(
            @PathVariable @Pattern(regexp = CHAIN_ID_REGEX, message = CHAIN_ID_MESSAGE) String chainId,
            @Valid @RequestBody AdminActionRequest request,
            HttpServletRequest httpRequest) {

        logger.info("User {} closing poll on chain {}", request.getOwner(), chainId);
        pollService.closePoll(ChainId.of(chainId), request, extractSigner(httpRequest));

        return ResponseEntity.noContent().build();
    }

    @GetMapping("/poll")
    @Operation(summary = "Get the full poll state")
    public ResponseEntity<PollStateDTO> getPoll(
            @PathVariable @Pattern(regexp = CHAIN_ID_REGEX, message = CHAIN_ID_MESSAGE) String chainId) {
        return ResponseEntity.ok(pollQueryService.getPoll(ChainId.of(chainId)));
    }

    @GetMapping("/results")
    @Operation(summary = "Get the computed results (available after close)")
    public ResponseEntity<List<ResultEntry>> getResults(
            @PathVariable @Pattern(regexp = CHAIN_ID_REGEX, message = CHAIN_ID_MESSAGE) String chainId) {
        return ResponseEntity.ok(pollQueryService.getResults(ChainId.of(chainId)));
    }

    @GetMapping("/nominations")
    @Operation(summary = "Get all nominations")
    public ResponseEntity<List<NominationEntry>> getNominations(
            @PathVariable @Pattern(regexp = CHAIN_ID_REGEX, message = CHAIN_ID_MESSAGE) String chainId) {
        return ResponseEntity.ok(pollQueryService.getNominations(ChainId.of(chainId)));
    }

    @GetMapping("/participants")
    @Operation(summary = "Get all participants and their count")
    public ResponseEntity<ParticipantsDTO> getParticipants(
            @PathVariable @Pattern(regexp = CHAIN_ID_REGEX, message = CHAIN_ID_MESSAGE) String chainId) {
        return ResponseEntity.ok(pollQueryService.getParticipants(ChainId.of(chainId)));
    }

    @GetMapping("/rankings")
    @Operation(summary = "Get all submitted rankings")
    public ResponseEntity<List<RankingEntry>> getRankings(
            @PathVariable @Pattern(regexp = CHAIN_ID_REGEX, message = CHAIN_ID_MESSAGE) String chainId) {
        return ResponseEntity.ok(pollQueryService.getRankings(ChainId.of(chainId)));
    }

    @GetMapping("/created-polls")
    @Operation(summary = "Get the poll chains a user created from this chain")
    public ResponseEntity<List<ChainId>> getCreatedPolls(
            @PathVariable @Pattern(regexp = CHAIN_ID_REGEX, message = CHAIN_ID_MESSAGE) String chainId,
            @RequestParam @NotBlank String userId) {
        return ResponseEntity.ok(pollQueryService.getCreatedPolls(ChainId.of(chainId), userId));
    }
}
