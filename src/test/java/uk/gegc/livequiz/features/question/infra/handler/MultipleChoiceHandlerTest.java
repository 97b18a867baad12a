package uk.gegc.livequiz.features.question.infra.handler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.livequiz.features.answer.domain.model.SubmissionPayload;
import uk.gegc.livequiz.features.question.application.scoring.ScoreOutcome;
import uk.gegc.livequiz.features.question.domain.model.AnswerKeyEntry;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static uk.gegc.livequiz.testsupport.AnswerKeyFixtures.multipleChoice;

class MultipleChoiceHandlerTest {

    private final MultipleChoiceHandler handler = new MultipleChoiceHandler();

    private ScoreOutcome score(List<Integer> selected, double timeRemaining) {
        AnswerKeyEntry key = multipleChoice(0, List.of(0, 2));
        return handler.score(new SubmissionPayload.MultiChoiceAnswer(selected), key, timeRemaining).getValue();
    }

    @Test
    @DisplayName("both correct plus one wrong option earns 800 and is partially correct")
    void allCorrectPlusOneWrong_isPartial() {
        ScoreOutcome outcome = score(List.of(0, 1, 2), 10);

        assertThat(outcome.points()).isEqualTo(800);
        assertThat(outcome.partiallyCorrect()).isTrue();
        assertThat(outcome.correct()).isFalse();
    }

    @Test
    @DisplayName("exact selection earns full credit and no more than 1000")
    void exactSelection_isCorrectAndCapped() {
        ScoreOutcome outcome = score(List.of(2, 0), 10);

        assertThat(outcome.correct()).isTrue();
        assertThat(outcome.points()).isEqualTo(1000);
    }

    @Test
    @DisplayName("half of the correct options earns half the points without a time bonus")
    void halfSelection_isPartialWithoutBonus() {
        ScoreOutcome outcome = score(List.of(0), 20);

        assertThat(outcome.points()).isEqualTo(500);
        assertThat(outcome.partiallyCorrect()).isTrue();
    }

    @Test
    @DisplayName("penalties never drive the score below zero")
    void heavyPenalty_floorsAtZero() {
        ScoreOutcome outcome = score(List.of(1, 3), 20);

        assertThat(outcome.points()).isZero();
        assertThat(outcome.correct()).isFalse();
        assertThat(outcome.partiallyCorrect()).isFalse();
    }

    @Test
    @DisplayName("empty selection scores nothing")
    void emptySelection_isIncorrect() {
        assertThat(score(List.of(), 20)).isEqualTo(ScoreOutcome.incorrect());
    }

    @Test
    @DisplayName("duplicate indices count once")
    void duplicateIndices_countOnce() {
        ScoreOutcome outcome = score(List.of(0, 0, 0), 0);

        assertThat(outcome.points()).isEqualTo(500);
    }
}
