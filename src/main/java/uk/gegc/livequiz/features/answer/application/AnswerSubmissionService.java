package uk.gegc.livequiz.features.answer.application;

import uk.gegc.livequiz.features.answer.api.dto.SubmitAnswerRequest;
import uk.gegc.livequiz.features.answer.api.dto.SubmitAnswerResponse;

public interface AnswerSubmissionService {

    /**
     * Validates, scores and records one answer, and adds its points to the participant's score.
     * Both writes commit together or not at all.
     *
     * @throws uk.gegc.livequiz.shared.exception.ValidationException          malformed or inconsistent submission
     * @throws uk.gegc.livequiz.shared.exception.ResourceNotFoundException    unknown session, question or participant
     * @throws uk.gegc.livequiz.shared.exception.PreconditionFailedException  question not open or already answered
     * @throws uk.gegc.livequiz.shared.exception.RateLimitExceededException   too many submissions from this participant
     * @throws uk.gegc.livequiz.shared.exception.AnswerCommitException        commit kept failing on concurrent writes
     */
    SubmitAnswerResponse submitAnswer(String sessionId, SubmitAnswerRequest request);
}
