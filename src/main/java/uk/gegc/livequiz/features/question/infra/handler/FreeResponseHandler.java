package uk.gegc.livequiz.features.question.infra.handler;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.livequiz.features.answer.domain.model.SubmissionPayload;
import uk.gegc.livequiz.features.question.application.scoring.FreeTextNormalizer;
import uk.gegc.livequiz.features.question.application.scoring.FuzzyTextMatcher;
import uk.gegc.livequiz.features.question.application.scoring.ScoreOutcome;
import uk.gegc.livequiz.features.question.domain.model.AnswerKeyEntry;
import uk.gegc.livequiz.features.question.domain.model.QuestionType;
import uk.gegc.livequiz.shared.result.Result;

import java.util.ArrayList;
import java.util.List;

/**
 * Binary correctness: exact match after normalization, or, when typos are allowed,
 * a similarity at or above a threshold chosen by the shortest accepted answer.
 */
@Component
@RequiredArgsConstructor
public class FreeResponseHandler extends QuestionHandler {

    private final FuzzyTextMatcher fuzzyTextMatcher;
    private final FreeTextNormalizer normalizer;

    @Override
    public QuestionType supportedType() {
        return QuestionType.FREE_RESPONSE;
    }

    @Override
    protected Result<ScoreOutcome> doScore(SubmissionPayload payload, AnswerKeyEntry key, double timeRemaining) {
        if (!(payload instanceof SubmissionPayload.TextAnswer text)) {
            return payloadMismatch(payload);
        }
        List<String> accepted = acceptedAnswers(key);
        if (accepted.isEmpty()) {
            return incompleteKey(key, "correct text");
        }

        String answer = normalizer.normalize(text.text(), key.isCaseSensitive());
        if (answer.isEmpty()) {
            return Result.success(ScoreOutcome.incorrect());
        }

        double bestSimilarity = 0.0;
        int shortestAccepted = Integer.MAX_VALUE;
        for (String candidate : accepted) {
            if (answer.equals(candidate)) {
                return Result.success(ScoreOutcome.correct(ScoreOutcome.MAX_POINTS));
            }
            bestSimilarity = Math.max(bestSimilarity, fuzzyTextMatcher.similarity(answer, candidate));
            shortestAccepted = Math.min(shortestAccepted, candidate.length());
        }

        if (key.isAllowTypos() && bestSimilarity >= similarityThreshold(shortestAccepted)) {
            return Result.success(ScoreOutcome.correct(ScoreOutcome.MAX_POINTS));
        }
        return Result.success(ScoreOutcome.incorrect());
    }

    static double similarityThreshold(int answerLength) {
        if (answerLength <= 5) {
            return 0.80;
        }
        if (answerLength <= 10) {
            return 0.85;
        }
        return 0.90;
    }

    private List<String> acceptedAnswers(AnswerKeyEntry key) {
        List<String> accepted = new ArrayList<>();
        addNormalized(accepted, key.getCorrectText(), key.isCaseSensitive());
        if (key.getAlternativeAnswers() != null) {
            key.getAlternativeAnswers().forEach(alt -> addNormalized(accepted, alt, key.isCaseSensitive()));
        }
        return accepted;
    }

    private void addNormalized(List<String> target, String raw, boolean caseSensitive) {
        String normalized = normalizer.normalize(raw, caseSensitive);
        if (!normalized.isEmpty()) {
            target.add(normalized);
        }
    }
}
