package uk.gegc.livequiz.features.session.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.livequiz.features.session.api.dto.*;
import uk.gegc.livequiz.features.session.application.SessionService;
import uk.gegc.livequiz.features.session.domain.model.ActivityType;
import uk.gegc.livequiz.features.session.domain.model.SessionState;
import uk.gegc.livequiz.shared.exception.PreconditionFailedException;
import uk.gegc.livequiz.shared.exception.ResourceNotFoundException;
import uk.gegc.livequiz.testsupport.WebMvcSecurityTestConfig;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SessionController.class)
@Import(WebMvcSecurityTestConfig.class)
@DisplayName("SessionController Tests")
class SessionControllerTest {

    private static final String SESSION_ID = "session-1";
    private static final Instant CREATED_AT = Instant.parse("2024-01-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SessionService sessionService;

    private static SessionDto session(SessionState state, int questionIndex) {
        return new SessionDto(SESSION_ID, "host", "Friday quiz", ActivityType.QUIZ, state, questionIndex,
                null, 3, 0, CREATED_AT);
    }

    @Nested
    @DisplayName("POST /api/v1/sessions")
    class Create {

        @Test
        @DisplayName("createSession: authenticated host gets 201")
        @WithMockUser(username = "host")
        void createSession_valid_returns201() throws Exception {
            when(sessionService.createSession(eq("host"), any(CreateSessionRequest.class)))
                    .thenReturn(session(SessionState.LOBBY, 0));

            mockMvc.perform(post("/api/v1/sessions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {
                                      "title": "Friday quiz",
                                      "activityType": "QUIZ",
                                      "questions": [
                                        {"questionType": "SINGLE_CHOICE", "optionLabels": ["A", "B"], "correctIndex": 1}
                                      ]
                                    }
                                    """))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.id").value(SESSION_ID))
                    .andExpect(jsonPath("$.state").value("LOBBY"))
                    .andExpect(jsonPath("$.questionCount").value(3))
                    .andExpect(jsonPath("$.correctIndex").doesNotExist());
        }

        @Test
        @DisplayName("createSession: blank title returns 400")
        @WithMockUser(username = "host")
        void createSession_blankTitle_returns400() throws Exception {
            mockMvc.perform(post("/api/v1/sessions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"title\": \" \", \"activityType\": \"QUIZ\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.fieldErrors[0].field").value("title"));

            verify(sessionService, never()).createSession(any(), any());
        }

        @Test
        @DisplayName("createSession: anonymous caller is unauthorized")
        void createSession_anonymous_returns401() throws Exception {
            mockMvc.perform(post("/api/v1/sessions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"title\": \"Quiz\", \"activityType\": \"QUIZ\"}"))
                    .andExpect(status().isUnauthorized());
        }
    }

    @Nested
    @DisplayName("POST /api/v1/sessions/{sessionId}/participants")
    class Join {

        @Test
        @DisplayName("joinSession: anonymous participant gets an id")
        void joinSession_anonymous_returns201() throws Exception {
            when(sessionService.joinSession(eq(SESSION_ID), any(JoinSessionRequest.class)))
                    .thenReturn(new ParticipantDto("p-1", SESSION_ID, "Alice", 0, 0, CREATED_AT));

            mockMvc.perform(post("/api/v1/sessions/{sessionId}/participants", SESSION_ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"displayName\": \"Alice\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.id").value("p-1"))
                    .andExpect(jsonPath("$.score").value(0));
        }

        @Test
        @DisplayName("joinSession: overlong display name returns 400")
        void joinSession_longName_returns400() throws Exception {
            mockMvc.perform(post("/api/v1/sessions/{sessionId}/participants", SESSION_ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"displayName\": \"" + "x".repeat(101) + "\"}"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("joinSession: unknown session returns 404")
        void joinSession_unknownSession_returns404() throws Exception {
            when(sessionService.joinSession(eq("missing"), any()))
                    .thenThrow(new ResourceNotFoundException("Session missing not found"));

            mockMvc.perform(post("/api/v1/sessions/{sessionId}/participants", "missing")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"displayName\": \"Alice\"}"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.errorCode").value("not-found"));
        }
    }

    @Nested
    @DisplayName("POST /api/v1/sessions/{sessionId}/state")
    class Transition {

        @Test
        @DisplayName("transitionState: host opens a question")
        @WithMockUser(username = "host")
        void transitionState_openQuestion_returns200() throws Exception {
            when(sessionService.transitionState(eq(SESSION_ID), any(TransitionStateRequest.class), eq("host")))
                    .thenReturn(session(SessionState.QUESTION, 1));

            mockMvc.perform(post("/api/v1/sessions/{sessionId}/state", SESSION_ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"state\": \"QUESTION\", \"questionIndex\": 1}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.state").value("QUESTION"))
                    .andExpect(jsonPath("$.currentQuestionIndex").value(1));
        }

        @Test
        @DisplayName("transitionState: ended session returns 409")
        @WithMockUser(username = "host")
        void transitionState_ended_returns409() throws Exception {
            when(sessionService.transitionState(eq(SESSION_ID), any(), eq("host")))
                    .thenThrow(new PreconditionFailedException("Session session-1 is ENDED and cannot change state"));

            mockMvc.perform(post("/api/v1/sessions/{sessionId}/state", SESSION_ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"state\": \"LOBBY\"}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.errorCode").value("failed-precondition"));
        }

        @Test
        @DisplayName("transitionState: negative question index returns 400")
        @WithMockUser(username = "host")
        void transitionState_negativeIndex_returns400() throws Exception {
            mockMvc.perform(post("/api/v1/sessions/{sessionId}/state", SESSION_ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"state\": \"QUESTION\", \"questionIndex\": -1}"))
                    .andExpect(status().isBadRequest());
        }
    }

    @Test
    @DisplayName("getSession: host reads the session")
    @WithMockUser(username = "host")
    void getSession_host_returns200() throws Exception {
        when(sessionService.getSession(SESSION_ID, "host")).thenReturn(session(SessionState.LEADERBOARD, 2));

        mockMvc.perform(get("/api/v1/sessions/{sessionId}", SESSION_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("LEADERBOARD"))
                .andExpect(jsonPath("$.createdAt").value("2024-01-01T12:00:00Z"));
    }
}
