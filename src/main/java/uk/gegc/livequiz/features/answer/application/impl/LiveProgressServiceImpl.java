package uk.gegc.livequiz.features.answer.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.livequiz.features.answer.api.dto.LiveProgressDto;
import uk.gegc.livequiz.features.answer.application.LiveProgressService;
import uk.gegc.livequiz.features.answer.application.SubmissionMetricsService;
import uk.gegc.livequiz.features.answer.domain.event.AnswerCommittedEvent;
import uk.gegc.livequiz.features.answer.domain.model.LiveQuestionProgress;
import uk.gegc.livequiz.features.answer.domain.repository.LiveQuestionProgressRepository;
import uk.gegc.livequiz.features.session.application.SessionAccessService;
import uk.gegc.livequiz.features.session.domain.repository.ParticipantRepository;
import uk.gegc.livequiz.shared.config.AsyncConfig;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Implementation of {@link LiveProgressService}.
 * <p>
 * Counters are updated after the answer transaction commits, on the general executor.
 * A failed update is logged and dropped; it never affects the participant's recorded answer.
 * </p>
 */
@Slf4j
@Service
public class LiveProgressServiceImpl implements LiveProgressService {

    private static final int MAX_RETRIES = 3;

    private final LiveQuestionProgressRepository progressRepository;
    private final ParticipantRepository participantRepository;
    private final SessionAccessService sessionAccessService;
    private final SubmissionMetricsService metricsService;
    private final Clock clock;

    // Self-reference to call @Transactional(REQUIRES_NEW) methods through proxy
    private final LiveProgressService self;

    public LiveProgressServiceImpl(
            LiveQuestionProgressRepository progressRepository,
            ParticipantRepository participantRepository,
            SessionAccessService sessionAccessService,
            SubmissionMetricsService metricsService,
            Clock clock,
            @Lazy LiveProgressService self
    ) {
        this.progressRepository = progressRepository;
        this.participantRepository = participantRepository;
        this.sessionAccessService = sessionAccessService;
        this.metricsService = metricsService;
        this.clock = clock;
        this.self = self;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordAnswer(String sessionId, int questionIndex, List<Integer> optionIndices) {
        LiveQuestionProgress progress = progressRepository.findBySessionIdAndQuestionIndex(sessionId, questionIndex)
                .orElseGet(() -> {
                    LiveQuestionProgress created = new LiveQuestionProgress();
                    created.setSessionId(sessionId);
                    created.setQuestionIndex(questionIndex);
                    return created;
                });
        progress.increment(optionIndices);
        progress.setUpdatedAt(clock.instant());
        progressRepository.saveAndFlush(progress);
    }

    @Override
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    @Async(AsyncConfig.PROGRESS_EXECUTOR)
    public void handleAnswerCommitted(AnswerCommittedEvent event) {
        if (event.isTimedOut()) {
            log.debug("Skipping progress update for timed-out answer of participant {}", event.getParticipantId());
            return;
        }

        int attempt = 0;
        while (attempt < MAX_RETRIES) {
            try {
                self.recordAnswer(event.getSessionId(), event.getQuestionIndex(), event.getOptionIndices());
                return;
            } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
                attempt++;
                if (attempt < MAX_RETRIES) {
                    log.debug("Progress update conflict for session {} question {} (attempt {}/{}), retrying",
                            event.getSessionId(), event.getQuestionIndex(), attempt, MAX_RETRIES);
                    try {
                        Thread.sleep(20L * attempt);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        log.warn("Progress update interrupted for session {}", event.getSessionId());
                        return;
                    }
                } else {
                    log.warn("Dropped progress update for session {} question {} after {} attempts due to {}",
                            event.getSessionId(), event.getQuestionIndex(), MAX_RETRIES, e.getClass().getSimpleName());
                    metricsService.incrementProgressUpdateFailed(event.getSessionId());
                }
            } catch (RuntimeException e) {
                log.error("Unexpected error updating progress for session {} question {}",
                        event.getSessionId(), event.getQuestionIndex(), e);
                metricsService.incrementProgressUpdateFailed(event.getSessionId());
                return;
            }
        }
    }

    @Override
    @Transactional(readOnly = true)
    public LiveProgressDto getProgress(String sessionId, int questionIndex, String username) {
        sessionAccessService.requireHostedSession(sessionId, username);
        long totalParticipants = participantRepository.countBySessionId(sessionId);

        return progressRepository.findBySessionIdAndQuestionIndex(sessionId, questionIndex)
                .map(progress -> new LiveProgressDto(
                        sessionId,
                        questionIndex,
                        progress.getTotalAnswered(),
                        totalParticipants,
                        new TreeMap<>(progress.getAnswerCounts())))
                .orElseGet(() -> new LiveProgressDto(sessionId, questionIndex, 0, totalParticipants, Map.of()));
    }
}
