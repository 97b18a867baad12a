package uk.gegc.livequiz.features.question.infra.handler;

import uk.gegc.livequiz.features.answer.domain.model.SubmissionPayload;
import uk.gegc.livequiz.features.question.application.scoring.ScoreOutcome;
import uk.gegc.livequiz.features.question.domain.model.AnswerKeyEntry;
import uk.gegc.livequiz.shared.result.Result;

/**
 * Polls are recorded for their distribution only and never award points.
 */
public abstract class PollHandler extends QuestionHandler {

    protected abstract Class<? extends SubmissionPayload> acceptedPayload();

    @Override
    protected Result<ScoreOutcome> doScore(SubmissionPayload payload, AnswerKeyEntry key, double timeRemaining) {
        if (!acceptedPayload().isInstance(payload)) {
            return payloadMismatch(payload);
        }
        return Result.success(ScoreOutcome.incorrect());
    }
}
