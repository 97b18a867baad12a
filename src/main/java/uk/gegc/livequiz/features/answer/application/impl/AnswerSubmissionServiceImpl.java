package uk.gegc.livequiz.features.answer.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.livequiz.features.answer.api.dto.SubmitAnswerRequest;
import uk.gegc.livequiz.features.answer.api.dto.SubmitAnswerResponse;
import uk.gegc.livequiz.features.answer.application.AnswerSubmissionService;
import uk.gegc.livequiz.features.answer.application.AnswerValidator;
import uk.gegc.livequiz.features.answer.application.SubmissionMetricsService;
import uk.gegc.livequiz.features.answer.domain.event.AnswerCommittedEvent;
import uk.gegc.livequiz.features.answer.domain.model.AnswerRecord;
import uk.gegc.livequiz.features.answer.domain.model.SubmissionPayload;
import uk.gegc.livequiz.features.answer.domain.repository.AnswerRecordRepository;
import uk.gegc.livequiz.features.question.application.scoring.ScoreOutcome;
import uk.gegc.livequiz.features.question.application.scoring.ScoringEngine;
import uk.gegc.livequiz.features.question.domain.model.AnswerKeyEntry;
import uk.gegc.livequiz.features.question.domain.repository.AnswerKeyEntryRepository;
import uk.gegc.livequiz.features.session.domain.model.LiveSession;
import uk.gegc.livequiz.features.session.domain.model.Participant;
import uk.gegc.livequiz.features.session.domain.repository.LiveSessionRepository;
import uk.gegc.livequiz.features.session.domain.repository.ParticipantRepository;
import uk.gegc.livequiz.shared.config.ScoringProperties;
import uk.gegc.livequiz.shared.config.SubmissionProperties;
import uk.gegc.livequiz.shared.ratelimit.RateLimitService;
import uk.gegc.livequiz.shared.result.ErrorKind;
import uk.gegc.livequiz.shared.result.Result;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Implementation of {@link AnswerSubmissionService}.
 * <p>
 * A submission goes through these stages:
 * <ol>
 *   <li>rate limiting per participant</li>
 *   <li>request validation and lookup of session, answer key and participant</li>
 *   <li>reconciliation of the client's remaining time with the server clock</li>
 *   <li>side-effect free scoring</li>
 *   <li>an atomic commit of the answer record and the score increment</li>
 * </ol>
 * </p>
 * <p>
 * The commit re-checks for an existing answer inside its transaction. Two concurrent submissions
 * for the same question collide on the {@code (participant_id, question_index)} unique key or on the
 * participant's version; the loser is rolled back, retried, and then sees the winner's record.
 * </p>
 */
@Slf4j
@Service
public class AnswerSubmissionServiceImpl implements AnswerSubmissionService {

    static final String RATE_LIMIT_OPERATION = "submit-answer";
    static final String ALREADY_ANSWERED = "Question already answered";

    private final LiveSessionRepository sessionRepository;
    private final AnswerKeyEntryRepository answerKeyRepository;
    private final ParticipantRepository participantRepository;
    private final AnswerRecordRepository answerRecordRepository;
    private final AnswerValidator answerValidator;
    private final ScoringEngine scoringEngine;
    private final RateLimitService rateLimitService;
    private final SubmissionMetricsService metricsService;
    private final ApplicationEventPublisher eventPublisher;
    private final ScoringProperties scoringProperties;
    private final SubmissionProperties submissionProperties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public AnswerSubmissionServiceImpl(
            LiveSessionRepository sessionRepository,
            AnswerKeyEntryRepository answerKeyRepository,
            ParticipantRepository participantRepository,
            AnswerRecordRepository answerRecordRepository,
            AnswerValidator answerValidator,
            ScoringEngine scoringEngine,
            RateLimitService rateLimitService,
            SubmissionMetricsService metricsService,
            ApplicationEventPublisher eventPublisher,
            ScoringProperties scoringProperties,
            SubmissionProperties submissionProperties,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.sessionRepository = sessionRepository;
        this.answerKeyRepository = answerKeyRepository;
        this.participantRepository = participantRepository;
        this.answerRecordRepository = answerRecordRepository;
        this.answerValidator = answerValidator;
        this.scoringEngine = scoringEngine;
        this.rateLimitService = rateLimitService;
        this.metricsService = metricsService;
        this.eventPublisher = eventPublisher;
        this.scoringProperties = scoringProperties;
        this.submissionProperties = submissionProperties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    @Override
    public SubmitAnswerResponse submitAnswer(String sessionId, SubmitAnswerRequest request) {
        String participantId = request != null ? request.participantId() : null;
        rateLimitService.checkRateLimit(RATE_LIMIT_OPERATION, sessionId + ":" + participantId);

        Result<SubmitAnswerResponse> result = process(sessionId, request);
        if (result.isFailure()) {
            log.debug("Rejected answer from participant {} in session {}: {} {}",
                    participantId, sessionId, result.getErrorKind(), result.getMessage());
            metricsService.incrementRejected(result.getErrorKind());
        }
        return result.orElseThrow();
    }

    private Result<SubmitAnswerResponse> process(String sessionId, SubmitAnswerRequest request) {
        Result<SubmitAnswerRequest> checked = answerValidator.validateRequest(request);
        if (checked.isFailure()) {
            return checked.propagate();
        }
        int questionIndex = request.questionIndex();

        LiveSession session = sessionRepository.findById(sessionId).orElse(null);
        if (session == null) {
            return Result.failure(ErrorKind.NOT_FOUND, "Session " + sessionId + " not found");
        }
        if (!session.acceptsAnswersFor(questionIndex)) {
            return Result.failure(ErrorKind.FAILED_PRECONDITION,
                    "Question " + questionIndex + " is not accepting answers");
        }

        AnswerKeyEntry key = answerKeyRepository.findBySessionIdAndQuestionIndex(sessionId, questionIndex).orElse(null);
        if (key == null) {
            return Result.failure(ErrorKind.NOT_FOUND, "Question " + questionIndex + " not found");
        }

        Participant participant = participantRepository.findByIdAndSessionId(request.participantId(), sessionId).orElse(null);
        if (participant == null) {
            return Result.failure(ErrorKind.NOT_FOUND, "Participant " + request.participantId() + " not found");
        }
        // Cheap early exit; the commit transaction repeats this check authoritatively
        if (answerRecordRepository.existsByParticipant_IdAndQuestionIndex(participant.getId(), questionIndex)) {
            return Result.failure(ErrorKind.FAILED_PRECONDITION, ALREADY_ANSWERED);
        }

        Result<SubmissionPayload> payload = answerValidator.validate(request, key);
        if (payload.isFailure()) {
            return payload.propagate();
        }

        Result<Double> effectiveTime = reconcileTimeRemaining(session, key, request.timeRemaining(), payload.getValue());
        if (effectiveTime.isFailure()) {
            return effectiveTime.propagate();
        }

        Result<ScoreOutcome> outcome = scoringEngine.score(payload.getValue(), key, effectiveTime.getValue());
        if (outcome.isFailure()) {
            return outcome.propagate();
        }

        return commitWithRetry(sessionId, participant.getId(), key, payload.getValue(),
                effectiveTime.getValue(), outcome.getValue());
    }

    /**
     * Bounds the client's remaining time by the server's view of the answer window.
     */
    Result<Double> reconcileTimeRemaining(LiveSession session, AnswerKeyEntry key, double clientTimeRemaining,
                                          SubmissionPayload payload) {
        int timeLimitSeconds = key.getTimeLimitSeconds() > 0
                ? key.getTimeLimitSeconds()
                : scoringProperties.getDefaultTimeLimitSeconds();
        double claimed = Math.min(Math.max(clientTimeRemaining, 0), timeLimitSeconds);

        Instant startedAt = session.getQuestionStartTime();
        if (startedAt == null) {
            return Result.success(claimed);
        }

        long elapsedMillis = Math.max(0, Duration.between(startedAt, clock.instant()).toMillis());
        long deadlineMillis = timeLimitSeconds * 1000L;
        boolean timeout = payload instanceof SubmissionPayload.NoAnswer;
        if (!timeout && elapsedMillis > deadlineMillis + scoringProperties.getGracePeriodMillis()) {
            return Result.failure(ErrorKind.FAILED_PRECONDITION, "Question " + key.getQuestionIndex() + " is closed");
        }

        double serverRemaining = Math.max(0, (deadlineMillis - elapsedMillis) / 1000.0);
        return Result.success(Math.min(claimed, serverRemaining));
    }

    private Result<SubmitAnswerResponse> commitWithRetry(String sessionId, String participantId, AnswerKeyEntry key,
                                                         SubmissionPayload payload, double timeRemaining,
                                                         ScoreOutcome outcome) {
        int maxAttempts = submissionProperties.getMaxCommitAttempts();
        long started = clock.millis();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Result<SubmitAnswerResponse> result = transactionTemplate.execute(status -> {
                    Result<SubmitAnswerResponse> committed =
                            commitOnce(sessionId, participantId, key, payload, timeRemaining, outcome);
                    if (committed.isFailure()) {
                        status.setRollbackOnly();
                    }
                    return committed;
                });
                metricsService.recordCommitLatency(clock.millis() - started);
                if (result != null && result.isSuccess()) {
                    metricsService.incrementAccepted(key.getQuestionType(), outcome.points());
                    log.debug("Recorded answer for participant {} on question {} of session {}: {} points",
                            participantId, key.getQuestionIndex(), sessionId, outcome.points());
                }
                return result;
            } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
                metricsService.incrementCommitConflict(sessionId, attempt);
                if (attempt < maxAttempts) {
                    log.debug("Commit conflict for participant {} on question {} (attempt {}/{}), retrying",
                            participantId, key.getQuestionIndex(), attempt, maxAttempts);
                    try {
                        Thread.sleep(submissionProperties.getRetryBackoffMillis() * attempt);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        log.warn("Answer commit interrupted for participant {} in session {}", participantId, sessionId);
                        return Result.failure(ErrorKind.INTERNAL, "Answer commit interrupted");
                    }
                } else {
                    log.error("Failed to record answer for participant {} on question {} of session {} after {} attempts due to {}",
                            participantId, key.getQuestionIndex(), sessionId, maxAttempts, e.getClass().getSimpleName(), e);
                }
            }
        }

        metricsService.incrementCommitExhausted(sessionId);
        return Result.failure(ErrorKind.INTERNAL,
                "Could not record answer after " + maxAttempts + " attempts");
    }

    private Result<SubmitAnswerResponse> commitOnce(String sessionId, String participantId, AnswerKeyEntry key,
                                                    SubmissionPayload payload, double timeRemaining,
                                                    ScoreOutcome outcome) {
        Participant participant = participantRepository.findByIdAndSessionId(participantId, sessionId).orElse(null);
        if (participant == null) {
            return Result.failure(ErrorKind.NOT_FOUND, "Participant " + participantId + " not found");
        }
        if (answerRecordRepository.existsByParticipant_IdAndQuestionIndex(participantId, key.getQuestionIndex())) {
            return Result.failure(ErrorKind.FAILED_PRECONDITION, ALREADY_ANSWERED);
        }

        AnswerRecord record = new AnswerRecord();
        record.setParticipant(participant);
        record.setQuestionIndex(key.getQuestionIndex());
        record.setQuestionType(key.getQuestionType());
        record.applyPayload(payload);
        record.setTimeRemaining(timeRemaining);
        record.setAnsweredAt(clock.instant());
        record.setPoints(outcome.points());
        record.setCorrect(outcome.correct());
        record.setPartiallyCorrect(outcome.partiallyCorrect());
        record.setTimedOut(outcome.timedOut());
        answerRecordRepository.saveAndFlush(record);

        participant.setScore(participant.getScore() + outcome.points());
        Participant saved = participantRepository.saveAndFlush(participant);

        eventPublisher.publishEvent(new AnswerCommittedEvent(
                this,
                sessionId,
                participantId,
                key.getQuestionIndex(),
                optionIndices(payload),
                outcome.timedOut()
        ));

        return Result.success(new SubmitAnswerResponse(
                true,
                outcome.correct(),
                outcome.partiallyCorrect(),
                outcome.points(),
                saved.getScore()
        ));
    }

    private static List<Integer> optionIndices(SubmissionPayload payload) {
        if (payload instanceof SubmissionPayload.ChoiceAnswer choice) {
            return List.of(choice.index());
        }
        if (payload instanceof SubmissionPayload.MultiChoiceAnswer multi) {
            return multi.indices();
        }
        return List.of();
    }
}
