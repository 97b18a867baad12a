package uk.gegc.livequiz.features.question.infra.handler;

import org.springframework.stereotype.Component;
import uk.gegc.livequiz.features.answer.domain.model.SubmissionPayload;
import uk.gegc.livequiz.features.question.application.scoring.ScoreOutcome;
import uk.gegc.livequiz.features.question.domain.model.AnswerKeyEntry;
import uk.gegc.livequiz.features.question.domain.model.QuestionType;
import uk.gegc.livequiz.shared.result.Result;

@Component
public class SingleChoiceHandler extends QuestionHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.SINGLE_CHOICE;
    }

    @Override
    protected Result<ScoreOutcome> doScore(SubmissionPayload payload, AnswerKeyEntry key, double timeRemaining) {
        if (!(payload instanceof SubmissionPayload.ChoiceAnswer choice)) {
            return payloadMismatch(payload);
        }
        if (key.getCorrectIndex() == null) {
            return incompleteKey(key, "correct index");
        }
        if (choice.index() != key.getCorrectIndex()) {
            return Result.success(ScoreOutcome.incorrect());
        }
        int points = Math.min(ScoreOutcome.MAX_POINTS,
                BASE_POINTS + timeBonus(timeRemaining, key.getTimeLimitSeconds()));
        return Result.success(ScoreOutcome.correct(points));
    }
}
