package com.bbthechange.mealvoting.controller;

import com.bbthechange.mealvoting.dto.message.InitializePollMessage;
import com.bbthechange.mealvoting.dto.message.PollMessage;
import com.bbthechange.mealvoting.exception.MessageNotAcceptedException;
import com.bbthechange.mealvoting.model.ChainDescription;
import com.bbthechange.mealvoting.model.ChainId;
import com.bbthechange.mealvoting.service.PollChainRuntime;
import com.bbthechange.mealvoting.service.PollService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.util.List;

/**
 * REST controller for the chain substrate: chain lookup and inbound message delivery.
 */
@RestController
@RequestMapping("/chains")
@Validated
@Tag(name = "Chains", description = "Chains hosting polls and delivery of cross-chain messages")
public class ChainController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(ChainController.class);

    private final PollChainRuntime chainRuntime;
    private final PollService pollService;

    @Autowired
    public ChainController(PollChainRuntime chainRuntime, PollService pollService) {
        this.chainRuntime = chainRuntime;
        this.pollService = pollService;
    }

    @GetMapping("/root")
    @Operation(summary = "Get the root chain, where polls can be created")
    public ResponseEntity<ChainDescription> getRootChain() {
        return ResponseEntity.ok(chainRuntime.getChain(chainRuntime.getRootChainId()));
    }

    @GetMapping
    @Operation(summary = "Get the chains owned by a signer")
    public ResponseEntity<List<ChainDescription>> getChainsByOwner(@RequestParam @NotBlank String owner) {
        return ResponseEntity.ok(chainRuntime.getChainsOwnedBy(owner));
    }

    @GetMapping("/{chainId}")
    @Operation(summary = "Get a chain's description")
    public ResponseEntity<ChainDescription> getChain(
            @PathVariable @Pattern(regexp = "[0-9a-f]{64}", message = "Invalid chain ID format") String chainId) {
        return ResponseEntity.ok(chainRuntime.getChain(ChainId.of(chainId)));
    }

    @PostMapping("/{chainId}/messages")
    @Operation(summary = "Deliver a cross-chain message to a chain's mailbox")
    public ResponseEntity<Void> deliverMessage(
            @PathVariable @Pattern(regexp = "[0-9a-f]{64}", message = "Invalid chain ID format") String chainId,
            @Valid @RequestBody PollMessage message) {

        logger.info("Received {} for chain {}", message.getType(), chainId);
        if (message instanceof InitializePollMessage) {
            // Only the chain that created the poll sends this, through the runtime
            throw new MessageNotAcceptedException(InitializePollMessage.TYPE + " cannot be delivered externally");
        }
        pollService.deliverMessage(ChainId.of(chainId), message);

        return ResponseEntity.accepted().build();
    }
}
