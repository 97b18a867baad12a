package uk.gegc.livequiz.features.question.infra.handler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.livequiz.features.answer.domain.model.SubmissionPayload;
import uk.gegc.livequiz.features.question.application.scoring.FreeTextNormalizer;
import uk.gegc.livequiz.features.question.application.scoring.FuzzyTextMatcher;
import uk.gegc.livequiz.features.question.application.scoring.ScoreOutcome;
import uk.gegc.livequiz.features.question.domain.model.AnswerKeyEntry;
import uk.gegc.livequiz.shared.result.ErrorKind;

import static org.assertj.core.api.Assertions.assertThat;
import static uk.gegc.livequiz.testsupport.AnswerKeyFixtures.freeResponse;

@DisplayName("FreeResponseHandler")
class FreeResponseHandlerTest {

    private final FuzzyTextMatcher matcher = new FuzzyTextMatcher();
    private final FreeResponseHandler handler = new FreeResponseHandler(matcher, new FreeTextNormalizer());

    private ScoreOutcome score(AnswerKeyEntry key, String answer) {
        return handler.score(new SubmissionPayload.TextAnswer(answer), key, 5).getValue();
    }

    @Nested
    @DisplayName("exact matching")
    class ExactMatching {

        @Test
        @DisplayName("trailing space and case difference still match")
        void normalizedEquality_isCorrect() {
            ScoreOutcome outcome = score(freeResponse(0, "Paris"), "paris ");

            assertThat(outcome.correct()).isTrue();
            assertThat(outcome.points()).isEqualTo(1000);
        }

        @Test
        @DisplayName("diacritics are ignored")
        void diacritics_areIgnored() {
            assertThat(score(freeResponse(0, "São Paulo"), "sao  paulo").correct()).isTrue();
        }

        @Test
        @DisplayName("alternative answers are accepted")
        void alternative_isCorrect() {
            assertThat(score(freeResponse(0, "Netherlands", "Holland"), "holland").correct()).isTrue();
        }

        @Test
        @DisplayName("case-sensitive key rejects a different case")
        void caseSensitive_rejectsDifferentCase() {
            AnswerKeyEntry key = freeResponse(0, "NaCl");
            key.setCaseSensitive(true);
            key.setAllowTypos(false);

            assertThat(score(key, "nacl").correct()).isFalse();
            assertThat(score(key, "NaCl").correct()).isTrue();
        }

        @Test
        @DisplayName("blank answer is incorrect")
        void blankAnswer_isIncorrect() {
            assertThat(score(freeResponse(0, "Paris"), "   ")).isEqualTo(ScoreOutcome.incorrect());
        }
    }

    @Nested
    @DisplayName("typo tolerance")
    class TypoTolerance {

        @Test
        @DisplayName("one deletion in a 9-letter answer clears the 0.85 threshold but not 0.90")
        void amsterdm_sitsBetweenThresholds() {
            double similarity = matcher.similarity("amsterdm", "amsterdam");

            assertThat(similarity).isBetween(0.888, 0.889);
            assertThat(similarity).isGreaterThanOrEqualTo(FreeResponseHandler.similarityThreshold(9));
            assertThat(similarity).isLessThan(FreeResponseHandler.similarityThreshold(11));
            assertThat(score(freeResponse(0, "Amsterdam"), "Amsterdm").correct()).isTrue();
        }

        @Test
        @DisplayName("same typo is rejected when typos are not allowed")
        void typosDisallowed_rejectsTypo() {
            AnswerKeyEntry key = freeResponse(0, "Amsterdam");
            key.setAllowTypos(false);

            assertThat(score(key, "Amsterdm").correct()).isFalse();
        }

        @Test
        @DisplayName("answers longer than 10 characters need 0.90 similarity")
        void longAnswer_usesStrictThreshold() {
            AnswerKeyEntry key = freeResponse(0, "Netherlands");

            assertThat(score(key, "Netherland").correct()).isTrue();
            assertThat(score(key, "Nethrland").correct()).isFalse();
        }

        @Test
        @DisplayName("short answers need 0.80 similarity")
        void shortAnswer_usesLenientThreshold() {
            AnswerKeyEntry key = freeResponse(0, "Rome");

            assertThat(score(key, "Roma").correct()).isFalse();
            assertThat(score(freeResponse(0, "Paris"), "Pariss").correct()).isTrue();
        }

        @Test
        @DisplayName("thresholds step at 5 and 10 characters")
        void thresholdSteps() {
            assertThat(FreeResponseHandler.similarityThreshold(5)).isEqualTo(0.80);
            assertThat(FreeResponseHandler.similarityThreshold(6)).isEqualTo(0.85);
            assertThat(FreeResponseHandler.similarityThreshold(10)).isEqualTo(0.85);
            assertThat(FreeResponseHandler.similarityThreshold(11)).isEqualTo(0.90);
        }
    }

    @Test
    @DisplayName("key without correct text is an internal failure")
    void keyWithoutText_isInternal() {
        AnswerKeyEntry key = freeResponse(0, "  ");

        assertThat(handler.score(new SubmissionPayload.TextAnswer("x"), key, 5).getErrorKind())
                .isEqualTo(ErrorKind.INTERNAL);
    }
}
