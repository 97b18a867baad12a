package uk.gegc.livequiz.features.session.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.livequiz.features.question.domain.model.AnswerKeyEntry;
import uk.gegc.livequiz.features.question.domain.model.QuestionType;
import uk.gegc.livequiz.features.question.domain.repository.AnswerKeyEntryRepository;
import uk.gegc.livequiz.features.ranking.domain.repository.RankingItemRepository;
import uk.gegc.livequiz.features.ranking.domain.repository.RankingMetricRepository;
import uk.gegc.livequiz.features.session.api.dto.*;
import uk.gegc.livequiz.features.session.application.SessionAccessService;
import uk.gegc.livequiz.features.session.application.SessionService;
import uk.gegc.livequiz.features.session.domain.model.ActivityType;
import uk.gegc.livequiz.features.session.domain.model.LiveSession;
import uk.gegc.livequiz.features.session.domain.model.Participant;
import uk.gegc.livequiz.features.session.domain.model.SessionState;
import uk.gegc.livequiz.features.session.domain.repository.LiveSessionRepository;
import uk.gegc.livequiz.features.session.domain.repository.ParticipantRepository;
import uk.gegc.livequiz.features.session.infra.mapping.SessionMapper;
import uk.gegc.livequiz.shared.config.ScoringProperties;
import uk.gegc.livequiz.shared.exception.PreconditionFailedException;
import uk.gegc.livequiz.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class SessionServiceImpl implements SessionService {

    private final LiveSessionRepository sessionRepository;
    private final ParticipantRepository participantRepository;
    private final AnswerKeyEntryRepository answerKeyRepository;
    private final RankingMetricRepository rankingMetricRepository;
    private final RankingItemRepository rankingItemRepository;
    private final SessionAccessService sessionAccessService;
    private final SessionMapper sessionMapper;
    private final ScoringProperties scoringProperties;
    private final Clock clock;

    @Override
    @Transactional
    public SessionDto createSession(String username, CreateSessionRequest request) {
        List<AnswerKeyRequest> questions = request.questions() != null ? request.questions() : List.of();
        List<RankingMetricRequest> metrics = request.metrics() != null ? request.metrics() : List.of();
        List<RankingItemRequest> items = request.items() != null ? request.items() : List.of();
        validateActivity(request.activityType(), questions, metrics, items);

        LiveSession session = new LiveSession();
        session.setId(UUID.randomUUID().toString());
        session.setHostId(username);
        session.setTitle(request.title());
        session.setActivityType(request.activityType());
        session.setState(SessionState.LOBBY);
        session.setCurrentQuestionIndex(0);
        session.setCreatedAt(clock.instant());
        LiveSession saved = sessionRepository.save(session);

        List<AnswerKeyEntry> entries = new ArrayList<>();
        for (int index = 0; index < questions.size(); index++) {
            AnswerKeyRequest question = questions.get(index);
            validateAnswerKey(index, question);
            entries.add(sessionMapper.toEntity(saved.getId(), index, question, scoringProperties.getDefaultTimeLimitSeconds()));
        }
        answerKeyRepository.saveAll(entries);

        for (int order = 0; order < metrics.size(); order++) {
            rankingMetricRepository.save(sessionMapper.toEntity(saved.getId(), order, metrics.get(order)));
        }
        for (int order = 0; order < items.size(); order++) {
            rankingItemRepository.save(sessionMapper.toEntity(saved.getId(), order, items.get(order)));
        }

        log.info("Created {} session {} for host {} with {} questions, {} metrics, {} items",
                saved.getActivityType(), saved.getId(), username, entries.size(), metrics.size(), items.size());
        return sessionMapper.toDto(saved, entries.size(), 0);
    }

    @Override
    @Transactional(readOnly = true)
    public SessionDto getSession(String sessionId, String username) {
        LiveSession session = sessionAccessService.requireHostedSession(sessionId, username);
        return toDto(session);
    }

    @Override
    @Transactional
    public ParticipantDto joinSession(String sessionId, JoinSessionRequest request) {
        LiveSession session = sessionAccessService.requireSession(sessionId);
        if (session.getState().isTerminal()) {
            throw new PreconditionFailedException("Session " + sessionId + " has ended");
        }

        Participant participant = new Participant();
        participant.setId(UUID.randomUUID().toString());
        participant.setSessionId(sessionId);
        participant.setDisplayName(request.displayName().trim());
        participant.setJoinedAt(clock.instant());
        Participant saved = participantRepository.save(participant);

        log.debug("Participant {} joined session {}", saved.getId(), sessionId);
        return sessionMapper.toDto(saved);
    }

    @Override
    @Transactional
    public SessionDto transitionState(String sessionId, TransitionStateRequest request, String username) {
        LiveSession session = sessionAccessService.requireHostedSession(sessionId, username);
        SessionState target = request.state();

        if (session.getState().isTerminal()) {
            throw new PreconditionFailedException("Session " + sessionId + " is " + session.getState()
                    + " and cannot change state");
        }

        int questionIndex = request.questionIndex() != null ? request.questionIndex() : session.getCurrentQuestionIndex();
        if (questionIndex < session.getCurrentQuestionIndex()) {
            throw new ValidationException("Cannot move back from question " + session.getCurrentQuestionIndex()
                    + " to question " + questionIndex);
        }

        if (target == SessionState.QUESTION) {
            openQuestion(session, questionIndex);
        } else if (questionIndex > session.getCurrentQuestionIndex()) {
            // Moving on to a question that has not been opened yet
            session.setCurrentQuestionIndex(questionIndex);
            session.setQuestionStartTime(null);
        }
        session.setState(target);

        log.info("Session {} moved to {} at question {}", sessionId, target, session.getCurrentQuestionIndex());
        return toDto(sessionRepository.save(session));
    }

    private void openQuestion(LiveSession session, int questionIndex) {
        boolean sameQuestion = questionIndex == session.getCurrentQuestionIndex();
        if (sameQuestion && session.getState() == SessionState.QUESTION) {
            // Already open; the answer window keeps its original start
            return;
        }
        if (sameQuestion && session.getQuestionStartTime() != null) {
            throw new PreconditionFailedException("Question " + questionIndex + " was already closed");
        }
        if (session.getActivityType() != ActivityType.RANKING
                && answerKeyRepository.findBySessionIdAndQuestionIndex(session.getId(), questionIndex).isEmpty()) {
            throw new ValidationException("Session " + session.getId() + " has no question " + questionIndex);
        }
        Instant now = clock.instant();
        session.setCurrentQuestionIndex(questionIndex);
        session.setQuestionStartTime(now);
    }

    private SessionDto toDto(LiveSession session) {
        return sessionMapper.toDto(
                session,
                answerKeyRepository.countBySessionId(session.getId()),
                participantRepository.countBySessionId(session.getId())
        );
    }

    private void validateActivity(ActivityType activityType, List<AnswerKeyRequest> questions,
                                  List<RankingMetricRequest> metrics, List<RankingItemRequest> items) {
        if (activityType != ActivityType.RANKING && (!metrics.isEmpty() || !items.isEmpty())) {
            throw new ValidationException("Metrics and items are only used by ranking activities");
        }
        if (activityType == ActivityType.RANKING && !questions.isEmpty()) {
            throw new ValidationException("A ranking activity has no questions");
        }
        switch (activityType) {
            case QUIZ -> {
                if (questions.isEmpty()) {
                    throw new ValidationException("A quiz needs at least one question");
                }
            }
            case POLL -> {
                if (questions.isEmpty()) {
                    throw new ValidationException("A poll needs at least one question");
                }
                boolean allPolls = questions.stream()
                        .allMatch(question -> question.questionType() != null && question.questionType().isPoll());
                if (!allPolls) {
                    throw new ValidationException("A poll can only contain poll questions");
                }
            }
            case RANKING -> {
                if (metrics.isEmpty() || items.isEmpty()) {
                    throw new ValidationException("A ranking activity needs at least one metric and one item");
                }
                validateUniqueKeys(metrics.stream().map(RankingMetricRequest::metricKey).toList(), "metric");
                validateUniqueKeys(items.stream().map(RankingItemRequest::itemKey).toList(), "item");
                for (RankingMetricRequest metric : metrics) {
                    if (metric.scaleMin() == null || metric.scaleMax() == null || metric.scaleMax() <= metric.scaleMin()) {
                        throw new ValidationException("Metric " + metric.metricKey() + " needs scaleMax greater than scaleMin");
                    }
                }
            }
        }
    }

    private void validateUniqueKeys(List<String> keys, String kind) {
        Set<String> seen = new HashSet<>();
        for (String key : keys) {
            if (!seen.add(key)) {
                throw new ValidationException("Duplicate " + kind + " key: " + key);
            }
        }
    }

    private void validateAnswerKey(int index, AnswerKeyRequest question) {
        QuestionType type = question.questionType();
        if (type == null) {
            throw new ValidationException("Question " + index + ": questionType is required");
        }
        int optionCount = question.optionLabels() != null ? question.optionLabels().size() : 0;
        String prefix = "Question " + index + " (" + type + "): ";

        switch (type) {
            case SINGLE_CHOICE -> {
                requireOptions(prefix, optionCount);
                if (question.correctIndex() == null || question.correctIndex() < 0 || question.correctIndex() >= optionCount) {
                    throw new ValidationException(prefix + "correctIndex must reference an option");
                }
            }
            case MULTIPLE_CHOICE -> {
                requireOptions(prefix, optionCount);
                List<Integer> correct = question.correctIndices();
                if (correct == null || correct.isEmpty()) {
                    throw new ValidationException(prefix + "correctIndices cannot be empty");
                }
                for (Integer correctIndex : correct) {
                    if (correctIndex == null || correctIndex < 0 || correctIndex >= optionCount) {
                        throw new ValidationException(prefix + "correctIndices must reference options");
                    }
                }
            }
            case SLIDER -> {
                Double min = question.minValue();
                Double max = question.maxValue();
                Double correct = question.correctValue();
                if (min == null || max == null || correct == null) {
                    throw new ValidationException(prefix + "minValue, maxValue and correctValue are required");
                }
                if (max <= min) {
                    throw new ValidationException(prefix + "maxValue must be greater than minValue");
                }
                if (correct < min || correct > max) {
                    throw new ValidationException(prefix + "correctValue must lie within the slider range");
                }
                if (question.acceptableError() != null && question.acceptableError() <= 0) {
                    throw new ValidationException(prefix + "acceptableError must be positive");
                }
            }
            case FREE_RESPONSE -> {
                if (question.correctText() == null || question.correctText().isBlank()) {
                    throw new ValidationException(prefix + "correctText is required");
                }
            }
            case POLL_SINGLE, POLL_MULTIPLE -> requireOptions(prefix, optionCount);
            case POLL_FREE_TEXT -> {
                // Free text polls have no options and no answer key
            }
        }
    }

    private void requireOptions(String prefix, int optionCount) {
        if (optionCount < 2) {
            throw new ValidationException(prefix + "at least two options are required");
        }
    }
}
