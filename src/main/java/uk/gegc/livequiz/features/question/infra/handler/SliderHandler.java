package uk.gegc.livequiz.features.question.infra.handler;

import org.springframework.stereotype.Component;
import uk.gegc.livequiz.features.answer.domain.model.SubmissionPayload;
import uk.gegc.livequiz.features.question.application.scoring.ScoreOutcome;
import uk.gegc.livequiz.features.question.domain.model.AnswerKeyEntry;
import uk.gegc.livequiz.features.question.domain.model.QuestionType;
import uk.gegc.livequiz.shared.result.Result;

/**
 * Quadratic accuracy score. Errors within 10% of the range (or the key's acceptable error)
 * are correct, errors within twice that are partially correct, anything further scores zero.
 */
@Component
public class SliderHandler extends QuestionHandler {

    static final double FULL_CREDIT_RATIO = 0.10;
    static final double PARTIAL_CREDIT_RATIO = 0.20;

    @Override
    public QuestionType supportedType() {
        return QuestionType.SLIDER;
    }

    @Override
    protected Result<ScoreOutcome> doScore(SubmissionPayload payload, AnswerKeyEntry key, double timeRemaining) {
        if (!(payload instanceof SubmissionPayload.SliderAnswer slider)) {
            return payloadMismatch(payload);
        }
        if (key.getCorrectValue() == null || key.getMinValue() == null || key.getMaxValue() == null) {
            return incompleteKey(key, "slider bounds");
        }

        double range = key.getMaxValue() - key.getMinValue();
        if (range <= 0) {
            return incompleteKey(key, "positive slider range");
        }

        double error = Math.abs(slider.value() - key.getCorrectValue());
        double fullCreditBand = key.getAcceptableError() != null
                ? key.getAcceptableError()
                : FULL_CREDIT_RATIO * range;
        double partialCreditBand = key.getAcceptableError() != null
                ? 2 * key.getAcceptableError()
                : PARTIAL_CREDIT_RATIO * range;

        if (error > partialCreditBand) {
            return Result.success(ScoreOutcome.incorrect());
        }

        double accuracy = Math.max(0.0, 1.0 - error / range);
        int points = (int) Math.round(ScoreOutcome.MAX_POINTS * accuracy * accuracy);

        return Result.success(error <= fullCreditBand
                ? ScoreOutcome.correct(points)
                : ScoreOutcome.partial(points));
    }
}
