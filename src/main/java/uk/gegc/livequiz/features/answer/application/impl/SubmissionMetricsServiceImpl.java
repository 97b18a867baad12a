package uk.gegc.livequiz.features.answer.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.livequiz.features.answer.application.SubmissionMetricsService;
import uk.gegc.livequiz.features.question.domain.model.QuestionType;
import uk.gegc.livequiz.shared.result.ErrorKind;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer-backed submission metrics. Every metric is also written as a structured log line.
 */
@Slf4j
@Service
public class SubmissionMetricsServiceImpl implements SubmissionMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter commitConflictCounter;
    private final Counter commitExhaustedCounter;
    private final Counter progressFailedCounter;
    private final Timer commitLatencyTimer;

    public SubmissionMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.commitConflictCounter = Counter.builder("livequiz.answers.commit.conflicts")
                .description("Answer commit attempts rolled back by a concurrent write")
                .register(meterRegistry);
        this.commitExhaustedCounter = Counter.builder("livequiz.answers.commit.exhausted")
                .description("Answer submissions that failed after all commit attempts")
                .register(meterRegistry);
        this.progressFailedCounter = Counter.builder("livequiz.progress.update.failed")
                .description("Live progress updates that were dropped")
                .register(meterRegistry);
        this.commitLatencyTimer = Timer.builder("livequiz.answers.commit.latency")
                .description("Time spent committing an answer, retries included")
                .register(meterRegistry);
    }

    @Override
    public void incrementAccepted(QuestionType questionType, int points) {
        log.debug("METRIC: livequiz.answers.accepted type={} points={}", questionType, points);
        // Tagged counters are cached by the registry after the first registration
        Counter.builder("livequiz.answers.accepted")
                .description("Answers recorded and scored")
                .tag("type", questionType.name())
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementRejected(ErrorKind errorKind) {
        log.info("METRIC: livequiz.answers.rejected errorCode={}", errorKind.code());
        Counter.builder("livequiz.answers.rejected")
                .description("Submissions refused before or during commit")
                .tag("errorCode", errorKind.code())
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementCommitConflict(String sessionId, int attempt) {
        log.info("METRIC: livequiz.answers.commit.conflicts sessionId={} attempt={}", sessionId, attempt);
        commitConflictCounter.increment();
    }

    @Override
    public void incrementCommitExhausted(String sessionId) {
        log.info("METRIC: livequiz.answers.commit.exhausted sessionId={}", sessionId);
        commitExhaustedCounter.increment();
    }

    @Override
    public void recordCommitLatency(long latencyMs) {
        log.debug("METRIC: livequiz.answers.commit.latency latencyMs={}", latencyMs);
        commitLatencyTimer.record(latencyMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void incrementProgressUpdateFailed(String sessionId) {
        log.info("METRIC: livequiz.progress.update.failed sessionId={}", sessionId);
        progressFailedCounter.increment();
    }
}
