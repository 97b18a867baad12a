package uk.gegc.livequiz.features.question.application.scoring;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.livequiz.features.answer.domain.model.SubmissionPayload;
import uk.gegc.livequiz.features.question.domain.model.AnswerKeyEntry;
import uk.gegc.livequiz.features.question.infra.factory.QuestionHandlerFactory;
import uk.gegc.livequiz.shared.result.Result;

/**
 * Entry point for scoring a validated submission. Side-effect free.
 */
@Component
@RequiredArgsConstructor
public class ScoringEngine {

    private final QuestionHandlerFactory handlerFactory;

    public Result<ScoreOutcome> score(SubmissionPayload payload, AnswerKeyEntry key, double timeRemaining) {
        double clamped = clampTimeRemaining(timeRemaining, key.getTimeLimitSeconds());
        return handlerFactory.getHandler(key.getQuestionType()).score(payload, key, clamped);
    }

    static double clampTimeRemaining(double timeRemaining, int timeLimitSeconds) {
        if (Double.isNaN(timeRemaining) || timeRemaining < 0) {
            return 0;
        }
        return Math.min(timeRemaining, timeLimitSeconds);
    }
}
