package uk.gegc.livequiz.features.ranking.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import uk.gegc.livequiz.features.ranking.domain.model.ConsensusLevel;
import uk.gegc.livequiz.features.ranking.domain.model.RankingMetric;
import uk.gegc.livequiz.features.ranking.domain.model.RankingResultsContent.MetricScore;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("RankingStatistics Tests")
class RankingStatisticsTest {

    private static RankingMetric metric(int min, int max, double weight, boolean lowerIsBetter) {
        RankingMetric metric = new RankingMetric();
        metric.setMetricKey("m-" + min + "-" + max);
        metric.setScaleMin(min);
        metric.setScaleMax(max);
        metric.setWeight(weight);
        metric.setLowerIsBetter(lowerIsBetter);
        return metric;
    }

    @Nested
    @DisplayName("Descriptive statistics")
    class Descriptive {

        @Test
        @DisplayName("median: averages the two middle values for an even count")
        void median_evenCount() {
            assertThat(RankingStatistics.median(List.of(5, 1, 4, 2))).isEqualTo(3.0);
            assertThat(RankingStatistics.median(List.of(3, 1, 2))).isEqualTo(2.0);
        }

        @Test
        @DisplayName("standardDeviation: population deviation, zero for a single value")
        void standardDeviation_population() {
            List<Integer> values = List.of(2, 4, 4, 4, 5, 5, 7, 9);

            assertThat(RankingStatistics.standardDeviation(values, RankingStatistics.mean(values))).isEqualTo(2.0);
            assertThat(RankingStatistics.standardDeviation(List.of(4), 4.0)).isZero();
        }

        @Test
        @DisplayName("distribution: counts per scale point and ignores values outside the scale")
        void distribution_countsPerScalePoint() {
            assertThat(RankingStatistics.distribution(List.of(1, 3, 3, 5, 9), 1, 5))
                    .containsExactly(1, 0, 2, 0, 1);
        }
    }

    @ParameterizedTest(name = "normalize({0}) on {1}..{2}, lowerIsBetter={3} -> {4}")
    @CsvSource({
            "3.0, 1, 5, false, 0.5",
            "5.0, 1, 5, false, 1.0",
            "2.0, 1, 5, true,  0.75",
            "7.0, 7, 7, false, 0.5"
    })
    @DisplayName("normalize: maps averages onto the unit interval")
    void normalize_mapsOntoUnitInterval(double average, int min, int max, boolean lowerIsBetter, double expected) {
        assertThat(RankingStatistics.normalize(average, min, max, lowerIsBetter)).isCloseTo(expected, within(1e-9));
    }

    @Nested
    @DisplayName("score")
    class Score {

        @Test
        @DisplayName("score: summarizes the ratings of one metric")
        void score_summarizesRatings() {
            // When
            MetricScore score = RankingStatistics.score(List.of(4, 5, 3, 4), metric(1, 5, 1.0, false));

            // Then
            assertThat(score.rawAverage()).isEqualTo(4.0);
            assertThat(score.normalizedAverage()).isEqualTo(0.75);
            assertThat(score.median()).isEqualTo(4.0);
            assertThat(score.stdDev()).isCloseTo(0.7071, within(1e-4));
            assertThat(score.distribution()).containsExactly(0, 0, 1, 2, 1);
            assertThat(score.responseCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("score: neutral score when nobody rated")
        void score_noRatings_isNeutral() {
            // When
            MetricScore score = RankingStatistics.score(List.of(), metric(1, 3, 1.0, false));

            // Then
            assertThat(score.normalizedAverage()).isEqualTo(0.5);
            assertThat(score.responseCount()).isZero();
            assertThat(score.distribution()).containsExactly(0, 0, 0);
        }
    }

    @Nested
    @DisplayName("overallScore")
    class Overall {

        @Test
        @DisplayName("overallScore: weights normalized averages by metric weight")
        void overallScore_weighted() {
            // Given
            List<RankingMetric> metrics = List.of(metric(1, 5, 3.0, false), metric(1, 5, 1.0, true));
            List<MetricScore> scores = List.of(
                    RankingStatistics.score(List.of(5, 5), metrics.get(0)),
                    RankingStatistics.score(List.of(5, 5), metrics.get(1))
            );

            // When
            double overall = RankingStatistics.overallScore(scores, metrics);

            // Then
            assertThat(overall).isCloseTo(0.75, within(1e-9));
        }

        @Test
        @DisplayName("overallScore: metrics without responses do not pull the score to neutral")
        void overallScore_skipsUnratedMetrics() {
            // Given
            List<RankingMetric> metrics = List.of(metric(1, 5, 1.0, false), metric(1, 5, 1.0, false));
            List<MetricScore> scores = List.of(
                    RankingStatistics.score(List.of(5), metrics.get(0)),
                    RankingStatistics.score(List.of(), metrics.get(1))
            );

            // When & Then
            assertThat(RankingStatistics.overallScore(scores, metrics)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("overallScore: zero when no metric has responses")
        void overallScore_noResponses_isZero() {
            List<RankingMetric> metrics = List.of(metric(1, 5, 1.0, false));

            assertThat(RankingStatistics.overallScore(List.of(RankingStatistics.score(List.of(), metrics.get(0))), metrics))
                    .isZero();
        }
    }

    @Nested
    @DisplayName("consensus")
    class Consensus {

        @Test
        @DisplayName("consensus: identical ratings are high consensus")
        void consensus_identicalRatings_high() {
            List<RankingMetric> metrics = List.of(metric(1, 5, 1.0, false));
            List<MetricScore> scores = List.of(RankingStatistics.score(List.of(4, 4, 4), metrics.get(0)));

            assertThat(RankingStatistics.consensus(scores, metrics)).isEqualTo(ConsensusLevel.HIGH);
        }

        @Test
        @DisplayName("consensus: polarized ratings are low consensus")
        void consensus_polarizedRatings_low() {
            // Given stdDev 2 on a scale of width 4
            List<RankingMetric> metrics = List.of(metric(1, 5, 1.0, false));
            List<MetricScore> scores = List.of(RankingStatistics.score(List.of(1, 5, 1, 5), metrics.get(0)));

            // When & Then
            assertThat(RankingStatistics.consensus(scores, metrics)).isEqualTo(ConsensusLevel.LOW);
        }

        @Test
        @DisplayName("consensus: moderate spread is medium consensus")
        void consensus_moderateSpread_medium() {
            // Given stdDev 1 on a scale of width 4
            List<RankingMetric> metrics = List.of(metric(1, 5, 1.0, false));
            List<MetricScore> scores = List.of(RankingStatistics.score(List.of(2, 4), metrics.get(0)));

            // When & Then
            assertThat(RankingStatistics.consensus(scores, metrics)).isEqualTo(ConsensusLevel.MEDIUM);
        }

        @Test
        @DisplayName("consensus: high when nobody rated")
        void consensus_noResponses_high() {
            List<RankingMetric> metrics = List.of(metric(1, 5, 1.0, false));
            List<MetricScore> scores = List.of(RankingStatistics.score(List.of(), metrics.get(0)));

            assertThat(RankingStatistics.consensus(scores, metrics)).isEqualTo(ConsensusLevel.HIGH);
        }
    }
}
