package uk.gegc.livequiz.features.ranking.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.livequiz.features.ranking.api.dto.ComputeRankingResultsResponse;
import uk.gegc.livequiz.features.ranking.api.dto.SubmitRatingsRequest;
import uk.gegc.livequiz.features.ranking.api.dto.SubmitRatingsResponse;
import uk.gegc.livequiz.features.ranking.application.RankingResultsService;
import uk.gegc.livequiz.features.ranking.application.RankingService;
import uk.gegc.livequiz.features.ranking.domain.model.ConsensusLevel;
import uk.gegc.livequiz.features.ranking.domain.model.RankingResultsContent;
import uk.gegc.livequiz.features.ranking.domain.model.RankingResultsContent.MetricScore;
import uk.gegc.livequiz.features.ranking.domain.model.RankingResultsContent.RankingItemResult;
import uk.gegc.livequiz.shared.exception.ValidationException;
import uk.gegc.livequiz.testsupport.WebMvcSecurityTestConfig;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RankingController.class)
@Import(WebMvcSecurityTestConfig.class)
@DisplayName("RankingController Tests")
class RankingControllerTest {

    private static final String SESSION_ID = "session-1";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private RankingService rankingService;

    @MockitoBean
    private RankingResultsService rankingResultsService;

    @Test
    @DisplayName("POST /ratings: anonymous participant submits ratings")
    void submitRatings_valid_returns200() throws Exception {
        when(rankingService.submitRatings(eq(SESSION_ID), any(SubmitRatingsRequest.class)))
                .thenReturn(new SubmitRatingsResponse(true, 2));

        mockMvc.perform(post("/api/v1/sessions/{sessionId}/ratings", SESSION_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "participantId": "p-1",
                                  "ratings": [
                                    {"itemKey": "idea-1", "metricKey": "impact", "value": 4},
                                    {"itemKey": "idea-2", "metricKey": "impact", "value": 2}
                                  ]
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ratingsRecorded").value(2));
    }

    @Test
    @DisplayName("POST /ratings: empty ratings list returns 400")
    void submitRatings_empty_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/sessions/{sessionId}/ratings", SESSION_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"participantId\": \"p-1\", \"ratings\": []}"))
                .andExpect(status().isBadRequest());

        verify(rankingService, never()).submitRatings(any(), any());
    }

    @Test
    @DisplayName("POST /ratings: out-of-scale value returns 400")
    void submitRatings_outOfScale_returns400() throws Exception {
        when(rankingService.submitRatings(eq(SESSION_ID), any()))
                .thenThrow(new ValidationException("Rating for impact must be between 1 and 5"));

        mockMvc.perform(post("/api/v1/sessions/{sessionId}/ratings", SESSION_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"participantId": "p-1", "ratings": [{"itemKey": "idea-1", "metricKey": "impact", "value": 9}]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("invalid-argument"));
    }

    @Test
    @DisplayName("POST /ranking-results: host computes results")
    @WithMockUser(username = "host")
    void computeRankingResults_host_returns200() throws Exception {
        when(rankingResultsService.computeRankingResults(SESSION_ID, "host"))
                .thenReturn(new ComputeRankingResultsResponse(true, 3, 2));

        mockMvc.perform(post("/api/v1/sessions/{sessionId}/ranking-results", SESSION_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalItems").value(3))
                .andExpect(jsonPath("$.participantsWhoRated").value(2));
    }

    @Test
    @DisplayName("POST /ranking-results: anonymous caller is unauthorized")
    void computeRankingResults_anonymous_returns401() throws Exception {
        mockMvc.perform(post("/api/v1/sessions/{sessionId}/ranking-results", SESSION_ID))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("GET /ranking-results: public results")
    void getRankingResults_anonymous_returns200() throws Exception {
        MetricScore impact = new MetricScore(4.5, 0.875, 4.5, 0.5, List.of(0, 0, 0, 1, 1), 2);
        RankingResultsContent content = new RankingResultsContent(
                List.of(new RankingItemResult("idea-1", "Ship it", null, 0.875, 1, Map.of("impact", impact),
                        ConsensusLevel.HIGH)),
                3,
                2
        );
        when(rankingResultsService.getRankingResults(SESSION_ID)).thenReturn(content);

        mockMvc.perform(get("/api/v1/sessions/{sessionId}/ranking-results", SESSION_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].itemId").value("idea-1"))
                .andExpect(jsonPath("$.items[0].itemDescription").doesNotExist())
                .andExpect(jsonPath("$.items[0].metricScores.impact.responseCount").value(2))
                .andExpect(jsonPath("$.items[0].consensusLevel").value("HIGH"))
                .andExpect(jsonPath("$.totalParticipants").value(3));
    }
}
