package uk.gegc.livequiz.features.question.infra.handler;

import org.springframework.stereotype.Component;
import uk.gegc.livequiz.features.answer.domain.model.SubmissionPayload;
import uk.gegc.livequiz.features.question.application.scoring.ScoreOutcome;
import uk.gegc.livequiz.features.question.domain.model.AnswerKeyEntry;
import uk.gegc.livequiz.features.question.domain.model.QuestionType;
import uk.gegc.livequiz.shared.result.Result;

import java.util.HashSet;
import java.util.Set;

/**
 * Proportional credit: {@code max(0, correctSelected/totalCorrect - 0.2 * wrongSelected)}.
 * Only an exact selection earns the time bonus.
 */
@Component
public class MultipleChoiceHandler extends QuestionHandler {

    static final double WRONG_SELECTION_PENALTY = 0.2;

    @Override
    public QuestionType supportedType() {
        return QuestionType.MULTIPLE_CHOICE;
    }

    @Override
    protected Result<ScoreOutcome> doScore(SubmissionPayload payload, AnswerKeyEntry key, double timeRemaining) {
        if (!(payload instanceof SubmissionPayload.MultiChoiceAnswer multi)) {
            return payloadMismatch(payload);
        }
        if (key.getCorrectIndices() == null || key.getCorrectIndices().isEmpty()) {
            return incompleteKey(key, "correct indices");
        }

        Set<Integer> correct = new HashSet<>(key.getCorrectIndices());
        Set<Integer> selected = new HashSet<>(multi.indices());

        int correctSelected = 0;
        int wrongSelected = 0;
        for (Integer index : selected) {
            if (correct.contains(index)) {
                correctSelected++;
            } else {
                wrongSelected++;
            }
        }

        double multiplier = Math.max(0.0,
                (double) correctSelected / correct.size() - WRONG_SELECTION_PENALTY * wrongSelected);
        boolean fullCredit = correctSelected == correct.size() && wrongSelected == 0;

        int points = (int) Math.round(ScoreOutcome.MAX_POINTS * multiplier);
        if (fullCredit) {
            points = Math.min(ScoreOutcome.MAX_POINTS, points + timeBonus(timeRemaining, key.getTimeLimitSeconds()));
            return Result.success(ScoreOutcome.correct(points));
        }
        if (multiplier > 0 && multiplier < 1) {
            return Result.success(ScoreOutcome.partial(points));
        }
        return Result.success(ScoreOutcome.incorrect());
    }
}
