package uk.gegc.livequiz.features.analytics.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.livequiz.features.analytics.api.dto.ComputeAnalyticsResponse;
import uk.gegc.livequiz.features.analytics.application.SessionAnalyticsCalculator;
import uk.gegc.livequiz.features.analytics.application.SessionAnalyticsService;
import uk.gegc.livequiz.features.analytics.domain.model.SessionAnalytics;
import uk.gegc.livequiz.features.analytics.domain.model.SessionAnalyticsReport;
import uk.gegc.livequiz.features.analytics.domain.repository.SessionAnalyticsRepository;
import uk.gegc.livequiz.features.question.domain.model.AnswerKeyEntry;
import uk.gegc.livequiz.features.question.domain.repository.AnswerKeyEntryRepository;
import uk.gegc.livequiz.features.session.application.SessionAccessService;
import uk.gegc.livequiz.features.session.domain.model.LiveSession;
import uk.gegc.livequiz.features.session.domain.model.Participant;
import uk.gegc.livequiz.features.session.domain.model.SessionState;
import uk.gegc.livequiz.features.session.domain.repository.ParticipantRepository;
import uk.gegc.livequiz.shared.exception.PreconditionFailedException;
import uk.gegc.livequiz.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class SessionAnalyticsServiceImpl implements SessionAnalyticsService {

    private final SessionAccessService sessionAccessService;
    private final AnswerKeyEntryRepository answerKeyRepository;
    private final ParticipantRepository participantRepository;
    private final SessionAnalyticsRepository analyticsRepository;
    private final SessionAnalyticsCalculator calculator;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional
    public ComputeAnalyticsResponse computeSessionAnalytics(String sessionId, String username) {
        LiveSession session = sessionAccessService.requireHostedSession(sessionId, username);
        if (session.getState() != SessionState.ENDED) {
            throw new PreconditionFailedException("Analytics can only be generated for ended sessions");
        }

        List<Participant> participants = participantRepository.findAllWithAnswersBySessionId(sessionId);
        if (participants.isEmpty()) {
            throw new PreconditionFailedException("No participants took part in session " + sessionId);
        }

        // Questions past the one the session ended on were never played
        List<AnswerKeyEntry> keys = answerKeyRepository
                .findBySessionIdAndQuestionIndexLessThanEqualOrderByQuestionIndexAsc(sessionId, session.getCurrentQuestionIndex());

        SessionAnalyticsReport report = calculator.compute(session, keys, participants);

        SessionAnalytics analytics = analyticsRepository.findById(sessionId).orElseGet(() -> {
            SessionAnalytics created = new SessionAnalytics();
            created.setSessionId(sessionId);
            return created;
        });
        analytics.setContent(serialize(report));
        analytics.setComputedAt(clock.instant());
        analyticsRepository.save(analytics);

        log.info("Computed analytics for session {}: {} players, {} questions",
                sessionId, report.totalPlayers(), report.totalQuestions());
        return new ComputeAnalyticsResponse(true, report.summary());
    }

    @Override
    @Transactional(readOnly = true)
    public SessionAnalyticsReport getSessionAnalytics(String sessionId, String username) {
        sessionAccessService.requireHostedSession(sessionId, username);
        SessionAnalytics analytics = analyticsRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("No analytics computed yet for session " + sessionId));
        try {
            return objectMapper.readValue(analytics.getContent(), SessionAnalyticsReport.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored analytics for session " + sessionId + " are unreadable", e);
        }
    }

    private String serialize(SessionAnalyticsReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize analytics report", e);
        }
    }
}
