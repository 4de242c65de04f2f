package com.bbthechange.mealvoting.controller;

import com.bbthechange.mealvoting.config.SignerFilter;
import com.bbthechange.mealvoting.dto.*;
import com.bbthechange.mealvoting.exception.ChainExecutionException;
import com.bbthechange.mealvoting.exception.ChainNotFoundException;
import com.bbthechange.mealvoting.exception.PollError;
import com.bbthechange.mealvoting.exception.PollOperationException;
import com.bbthechange.mealvoting.model.ChainId;
import com.bbthechange.mealvoting.model.ResultEntry;
import com.bbthechange.mealvoting.service.PollQueryService;
import com.bbthechange.mealvoting.service.PollService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for PollController.
 *
 * Test Coverage:
 * - POST /chains/{chainId}/polls - Create poll (signer header)
 * - POST participants, nominations, votes, start, close
 * - GET poll, results, created-polls
 * - Error mapping (400, 403, 404, 409, 503)
 */
@WebMvcTest(controllers = PollController.class)
@TestPropertySource(locations = "classpath:application-test.properties")
@ActiveProfiles("test")
@DisplayName("PollController Tests")
class PollControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private PollService pollService;

    @MockitoBean
    private PollQueryService pollQueryService;

    private ChainId chainId;
    private String basePath;

    @BeforeEach
    void setUp() {
        chainId = ChainId.generate();
        basePath = "/chains/" + chainId;
    }

    @Nested
    @DisplayName("POST /chains/{chainId}/polls - Create Poll Tests")
    class CreatePollTests {

        @Test
        @DisplayName("Should create poll with signer and return 201")
        void createPoll_WithSigner_Returns201() throws Exception {
            // Given
            ChainId pollChain = ChainId.generate();
            CreatePollRequest request = new CreatePollRequest("Dinner", 2, "alice");
            when(pollService.createPoll(eq(chainId), any(CreatePollRequest.class), eq("signer-1")))
                .thenReturn(new CreatePollResponse(pollChain, chainId, "Dinner"));

            // When & Then
            mockMvc.perform(post(basePath + "/polls")
                    .header(SignerFilter.SIGNER_HEADER, "signer-1")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.chainId").value(pollChain.value()))
                .andExpect(jsonPath("$.creatorChainId").value(chainId.value()))
                .andExpect(jsonPath("$.topic").value("Dinner"));
        }

        @Test
        @DisplayName("Should return 401 when no signer is present")
        void createPoll_WithoutSigner_Returns401() throws Exception {
            // Given
            when(pollService.createPoll(eq(chainId), any(CreatePollRequest.class), isNull()))
                .thenThrow(new PollOperationException(PollError.AUTHENTICATION_MISSING));

            // When & Then
            mockMvc.perform(post(basePath + "/polls")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(new CreatePollRequest("Dinner", 2, "alice"))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("AUTHENTICATION_MISSING"))
                .andExpect(jsonPath("$.message").value("Needs authenticated signer to create poll"));
        }

        @Test
        @DisplayName("Should return 400 for blank topic")
        void createPoll_BlankTopic_Returns400() throws Exception {
            mockMvc.perform(post(basePath + "/polls")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(new CreatePollRequest("", 2, "alice"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

            verifyNoInteractions(pollService);
        }

        @Test
        @DisplayName("Should return 400 for malformed chain id")
        void createPoll_InvalidChainId_Returns400() throws Exception {
            mockMvc.perform(post("/chains/not-a-chain/polls")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(new CreatePollRequest("Dinner", 2, "alice"))))
                .andExpect(status().isBadRequest());

            verifyNoInteractions(pollService);
        }
    }

    @Nested
    @DisplayName("Poll mutation tests")
    class MutationTests {

        @Test
        void join_Valid_Returns204() throws Exception {
            mockMvc.perform(post(basePath + "/participants")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(new JoinRequest("Bob", "bob"))))
                .andExpect(status().isNoContent());

            verify(pollService).join(eq(chainId), any(JoinRequest.class), isNull());
        }

        @Test
        void nominate_AfterVotingStarted_Returns409() throws Exception {
            // Given
            doThrow(new PollOperationException(PollError.VOTING_ALREADY_STARTED))
                .when(pollService).nominate(eq(chainId), any(NominateRequest.class), any());

            // When & Then
            mockMvc.perform(post(basePath + "/nominations")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(new NominateRequest("Pizza", "bob"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("VOTING_ALREADY_STARTED"));
        }

        @Test
        void vote_TooManyRankings_Returns400() throws Exception {
            // Given
            doThrow(new PollOperationException(PollError.TOO_MANY_RANKINGS, "Too many rankings. Max allowed: 1"))
                .when(pollService).vote(eq(chainId), any(VoteRequest.class), any());

            // When & Then
            mockMvc.perform(post(basePath + "/votes")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(new VoteRequest(List.of("nom_0", "nom_1"), "bob"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("TOO_MANY_RANKINGS"))
                .andExpect(jsonPath("$.message").value("Too many rankings. Max allowed: 1"));
        }

        @Test
        void vote_MissingRankings_Returns400() throws Exception {
            mockMvc.perform(post(basePath + "/votes")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"owner\":\"bob\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
        }

        @Test
        void vote_NullRankedId_Returns400() throws Exception {
            mockMvc.perform(post(basePath + "/votes")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"rankings\":[\"nom_0\",null],\"owner\":\"bob\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

            verifyNoInteractions(pollService);
        }

        @Test
        void startVote_NonAdmin_Returns403() throws Exception {
            // Given
            doThrow(new PollOperationException(PollError.NOT_ADMIN, "Only admin can start voting"))
                .when(pollService).startVote(eq(chainId), any(AdminActionRequest.class), any());

            // When & Then
            mockMvc.perform(post(basePath + "/start")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(new AdminActionRequest("bob"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("NOT_ADMIN"));
        }

        @Test
        void closePoll_RuntimeUnavailable_Returns503() throws Exception {
            // Given
            doThrow(new ChainExecutionException("Call on chain timed out"))
                .when(pollService).closePoll(eq(chainId), any(AdminActionRequest.class), any());

            // When & Then
            mockMvc.perform(post(basePath + "/close")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(new AdminActionRequest("alice"))))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("CHAIN_UNAVAILABLE"));
        }
    }

    @Nested
    @DisplayName("Poll query tests")
    class QueryTests {

        @Test
        void getPoll_ReturnsStateWithIsClosedField() throws Exception {
            // Given
            PollStateDTO dto = new PollStateDTO();
            dto.setChainId(chainId);
            dto.setTopic("Dinner");
            dto.setAdminId("alice");
            dto.setVotesPerVoter(2);
            dto.setClosed(true);
            when(pollQueryService.getPoll(chainId)).thenReturn(dto);

            // When & Then
            mockMvc.perform(get(basePath + "/poll"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.topic").value("Dinner"))
                .andExpect(jsonPath("$.isClosed").value(true))
                .andExpect(jsonPath("$.hasStarted").value(false));
        }

        @Test
        void getResults_ReturnsOrderedEntries() throws Exception {
            // Given
            when(pollQueryService.getResults(chainId)).thenReturn(List.of(
                new ResultEntry("nom_1", "Sushi", 3), new ResultEntry("nom_0", "Pizza", 2)));

            // When & Then
            mockMvc.perform(get(basePath + "/results"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].nominationText").value("Sushi"))
                .andExpect(jsonPath("$[0].score").value(3))
                .andExpect(jsonPath("$[1].nominationId").value("nom_0"));
        }

        @Test
        void getCreatedPolls_ReturnsChainIdsAsStrings() throws Exception {
            // Given
            ChainId created = ChainId.generate();
            when(pollQueryService.getCreatedPolls(chainId, "alice")).thenReturn(List.of(created));

            // When & Then
            mockMvc.perform(get(basePath + "/created-polls").param("userId", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value(created.value()));
        }

        @Test
        void getNominations_UnknownChain_Returns404() throws Exception {
            // Given
            when(pollQueryService.getNominations(chainId))
                .thenThrow(new ChainNotFoundException("Chain not found: " + chainId));

            // When & Then
            mockMvc.perform(get(basePath + "/nominations"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("CHAIN_NOT_FOUND"));
        }
    }
}
