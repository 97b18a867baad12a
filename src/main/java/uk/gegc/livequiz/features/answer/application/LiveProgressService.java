package uk.gegc.livequiz.features.answer.application;

import uk.gegc.livequiz.features.answer.api.dto.LiveProgressDto;
import uk.gegc.livequiz.features.answer.domain.event.AnswerCommittedEvent;

import java.util.List;

/**
 * Best-effort live answer counters for the question in progress.
 */
public interface LiveProgressService {

    /**
     * Adds one committed answer to the counters, creating them on first use.
     * Runs in its own transaction.
     */
    void recordAnswer(String sessionId, int questionIndex, List<Integer> optionIndices);

    void handleAnswerCommitted(AnswerCommittedEvent event);

    /**
     * Host-only view of the counters. Returns zero counts when nothing was recorded yet.
     */
    LiveProgressDto getProgress(String sessionId, int questionIndex, String username);
}
