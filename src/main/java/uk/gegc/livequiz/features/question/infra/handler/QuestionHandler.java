package uk.gegc.livequiz.features.question.infra.handler;

import uk.gegc.livequiz.features.answer.domain.model.SubmissionPayload;
import uk.gegc.livequiz.features.question.application.scoring.ScoreOutcome;
import uk.gegc.livequiz.features.question.domain.model.AnswerKeyEntry;
import uk.gegc.livequiz.features.question.domain.model.QuestionType;
import uk.gegc.livequiz.shared.result.ErrorKind;
import uk.gegc.livequiz.shared.result.Result;

/**
 * Scores submissions for one {@link QuestionType}.
 * Timed-out submissions are handled here so that every type records them the same way.
 */
public abstract class QuestionHandler {

    static final int BASE_POINTS = 100;
    static final int MAX_TIME_BONUS = 900;

    /**
     * Returns the question type that this handler supports
     * @return the supported question type
     */
    public abstract QuestionType supportedType();

    /**
     * @param timeRemaining seconds left on the clock, already clamped to {@code [0, timeLimit]}
     */
    public Result<ScoreOutcome> score(SubmissionPayload payload, AnswerKeyEntry key, double timeRemaining) {
        if (key.getQuestionType() != supportedType()) {
            return Result.failure(ErrorKind.INTERNAL,
                    "Handler for " + supportedType() + " cannot score " + key.getQuestionType());
        }
        if (payload instanceof SubmissionPayload.NoAnswer) {
            return Result.success(ScoreOutcome.timeout());
        }
        return doScore(payload, key, timeRemaining);
    }

    protected abstract Result<ScoreOutcome> doScore(SubmissionPayload payload, AnswerKeyEntry key, double timeRemaining);

    /**
     * Linear bonus of up to 900 points for the fraction of the time limit left.
     */
    protected static int timeBonus(double timeRemaining, int timeLimitSeconds) {
        if (timeLimitSeconds <= 0) {
            return 0;
        }
        return (int) Math.round((timeRemaining / timeLimitSeconds) * MAX_TIME_BONUS);
    }

    protected Result<ScoreOutcome> payloadMismatch(SubmissionPayload payload) {
        return Result.failure(ErrorKind.INVALID_ARGUMENT,
                supportedType() + " question cannot accept " + payload.getClass().getSimpleName());
    }

    protected Result<ScoreOutcome> incompleteKey(AnswerKeyEntry key, String missing) {
        return Result.failure(ErrorKind.INTERNAL,
                "Answer key for question " + key.getQuestionIndex() + " has no " + missing);
    }
}
