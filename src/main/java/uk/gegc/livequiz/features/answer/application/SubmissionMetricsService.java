package uk.gegc.livequiz.features.answer.application;

import uk.gegc.livequiz.features.question.domain.model.QuestionType;
import uk.gegc.livequiz.shared.result.ErrorKind;

/**
 * Counters and timers for the answer submission path.
 */
public interface SubmissionMetricsService {

    void incrementAccepted(QuestionType questionType, int points);

    void incrementRejected(ErrorKind errorKind);

    void incrementCommitConflict(String sessionId, int attempt);

    void incrementCommitExhausted(String sessionId);

    void recordCommitLatency(long latencyMs);

    void incrementProgressUpdateFailed(String sessionId);
}
