package com.bbthechange.mealvoting.controller;

import com.bbthechange.mealvoting.dto.message.NominateMessage;
import com.bbthechange.mealvoting.dto.message.PollMessage;
import com.bbthechange.mealvoting.exception.ChainNotFoundException;
import com.bbthechange.mealvoting.model.ChainDescription;
import com.bbthechange.mealvoting.model.ChainId;
import com.bbthechange.mealvoting.service.PollChainRuntime;
import com.bbthechange.mealvoting.service.PollService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = ChainController.class)
@TestPropertySource(locations = "classpath:application-test.properties")
@ActiveProfiles("test")
@DisplayName("ChainController Tests")
class ChainControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PollChainRuntime chainRuntime;

    @MockitoBean
    private PollService pollService;

    @Test
    void getRootChain_ReturnsDescription() throws Exception {
        // Given
        ChainId root = ChainId.generate();
        when(chainRuntime.getRootChainId()).thenReturn(root);
        when(chainRuntime.getChain(root))
            .thenReturn(new ChainDescription(root, "test-root", BigDecimal.TEN, null, Instant.now()));

        // When & Then
        mockMvc.perform(get("/chains/root"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.chainId").value(root.value()))
            .andExpect(jsonPath("$.owner").value("test-root"));
    }

    @Test
    void getChainsByOwner_ReturnsOwnedChains() throws Exception {
        // Given
        ChainId chainId = ChainId.generate();
        when(chainRuntime.getChainsOwnedBy("signer-1"))
            .thenReturn(List.of(new ChainDescription(chainId, "signer-1", BigDecimal.TEN, null, Instant.now())));

        // When & Then
        mockMvc.perform(get("/chains").param("owner", "signer-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].chainId").value(chainId.value()));
    }

    @Test
    void getChain_Unknown_Returns404() throws Exception {
        // Given
        ChainId chainId = ChainId.generate();
        when(chainRuntime.getChain(chainId)).thenThrow(new ChainNotFoundException("Chain not found: " + chainId));

        // When & Then
        mockMvc.perform(get("/chains/" + chainId))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("CHAIN_NOT_FOUND"));
    }

    @Test
    void deliverMessage_Valid_Returns202AndHandsOffTypedMessage() throws Exception {
        // Given
        ChainId chainId = ChainId.generate();

        // When
        mockMvc.perform(post("/chains/" + chainId + "/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"NOMINATE\",\"userId\":\"alice\",\"text\":\"Pizza\"}"))
            .andExpect(status().isAccepted());

        // Then
        ArgumentCaptor<PollMessage> captor = ArgumentCaptor.forClass(PollMessage.class);
        verify(pollService).deliverMessage(eq(chainId), captor.capture());
        assertThat(captor.getValue()).isInstanceOfSatisfying(NominateMessage.class, message -> {
            assertThat(message.getUserId()).isEqualTo("alice");
            assertThat(message.getText()).isEqualTo("Pizza");
        });
    }

    @Test
    void deliverMessage_InitializePoll_Returns400AndIsNotDelivered() throws Exception {
        mockMvc.perform(post("/chains/" + ChainId.generate() + "/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"INITIALIZE_POLL\",\"topic\":\"Dinner\",\"votesPerVoter\":2,\"adminId\":\"mallory\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("MESSAGE_NOT_ACCEPTED"));

        verifyNoInteractions(pollService);
    }

    @Test
    void deliverMessage_InitializePollWithNegativeVotes_Returns400() throws Exception {
        mockMvc.perform(post("/chains/" + ChainId.generate() + "/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"INITIALIZE_POLL\",\"topic\":\"Dinner\",\"votesPerVoter\":-1,\"adminId\":\"mallory\"}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(pollService);
    }

    @Test
    void deliverMessage_VoteWithBlankRankedId_Returns400() throws Exception {
        mockMvc.perform(post("/chains/" + ChainId.generate() + "/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"VOTE\",\"userId\":\"alice\",\"rankings\":[\"nom_0\",\"\"]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        verifyNoInteractions(pollService);
    }

    @Test
    void deliverMessage_UnknownType_Returns400() throws Exception {
        mockMvc.perform(post("/chains/" + ChainId.generate() + "/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"DELETE_POLL\",\"userId\":\"alice\"}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(pollService);
    }
}
