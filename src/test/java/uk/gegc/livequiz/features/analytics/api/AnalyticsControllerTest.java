package uk.gegc.livequiz.features.analytics.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.livequiz.features.analytics.api.dto.ComputeAnalyticsResponse;
import uk.gegc.livequiz.features.analytics.application.SessionAnalyticsService;
import uk.gegc.livequiz.features.analytics.domain.model.SessionAnalyticsReport;
import uk.gegc.livequiz.features.analytics.domain.model.SessionAnalyticsReport.*;
import uk.gegc.livequiz.features.question.domain.model.QuestionType;
import uk.gegc.livequiz.shared.exception.PreconditionFailedException;
import uk.gegc.livequiz.testsupport.WebMvcSecurityTestConfig;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AnalyticsController.class)
@Import(WebMvcSecurityTestConfig.class)
@DisplayName("AnalyticsController Tests")
class AnalyticsControllerTest {

    private static final String SESSION_ID = "session-1";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SessionAnalyticsService analyticsService;

    private static AnalyticsSummary summary() {
        return new AnalyticsSummary(2, 1, new QuestionRate(0, 50.0), new QuestionRate(0, 50.0), 450.0, 50.0, 0.0);
    }

    @Test
    @DisplayName("POST /analytics: host computes analytics")
    @WithMockUser(username = "host")
    void computeAnalytics_host_returns200() throws Exception {
        when(analyticsService.computeSessionAnalytics(SESSION_ID, "host"))
                .thenReturn(new ComputeAnalyticsResponse(true, summary()));

        mockMvc.perform(post("/api/v1/sessions/{sessionId}/analytics", SESSION_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.summary.totalPlayers").value(2))
                .andExpect(jsonPath("$.summary.hardestQuestion.questionIndex").value(0));
    }

    @Test
    @DisplayName("POST /analytics: session still running returns 409")
    @WithMockUser(username = "host")
    void computeAnalytics_notEnded_returns409() throws Exception {
        when(analyticsService.computeSessionAnalytics(SESSION_ID, "host"))
                .thenThrow(new PreconditionFailedException("Analytics can only be generated for ended sessions"));

        mockMvc.perform(post("/api/v1/sessions/{sessionId}/analytics", SESSION_ID))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.detail").value("Analytics can only be generated for ended sessions"));
    }

    @Test
    @DisplayName("GET /analytics: anonymous caller is unauthorized")
    void getAnalytics_anonymous_returns401() throws Exception {
        mockMvc.perform(get("/api/v1/sessions/{sessionId}/analytics", SESSION_ID))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("GET /analytics: returns the stored report")
    @WithMockUser(username = "host")
    void getAnalytics_host_returns200() throws Exception {
        QuestionStats stats = new QuestionStats(0, QuestionType.SINGLE_CHOICE, "Capital of France?", 2, 0, 0.0, 100.0,
                1, 50.0, 450.0, List.of(new OptionStat("Paris", 1, 50.0, true), new OptionStat("Lyon", 1, 50.0, false)),
                null, null);
        SessionAnalyticsReport report = new SessionAnalyticsReport(SESSION_ID, "Friday quiz", 1, 2,
                List.of(stats), List.of(), List.of(new ScoreBin(0, 899, 2)), List.of(), summary());
        when(analyticsService.getSessionAnalytics(SESSION_ID, "host")).thenReturn(report);

        mockMvc.perform(get("/api/v1/sessions/{sessionId}/analytics", SESSION_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.questionStats[0].answerDistribution[0].isCorrect").value(true))
                .andExpect(jsonPath("$.questionStats[0].sliderDistribution").doesNotExist())
                .andExpect(jsonPath("$.scoreDistribution[0].count").value(2));
    }
}
