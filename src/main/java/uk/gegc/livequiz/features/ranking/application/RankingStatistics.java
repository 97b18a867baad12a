package uk.gegc.livequiz.features.ranking.application;

import uk.gegc.livequiz.features.ranking.domain.model.ConsensusLevel;
import uk.gegc.livequiz.features.ranking.domain.model.RankingMetric;
import uk.gegc.livequiz.features.ranking.domain.model.RankingResultsContent.MetricScore;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Descriptive statistics over the integer ratings of one item on one metric.
 */
public final class RankingStatistics {

    static final double NEUTRAL_SCORE = 0.5;

    private RankingStatistics() {
    }

    public static double mean(List<Integer> values) {
        if (values.isEmpty()) {
            return 0;
        }
        long sum = 0;
        for (int value : values) {
            sum += value;
        }
        return (double) sum / values.size();
    }

    public static double median(List<Integer> values) {
        if (values.isEmpty()) {
            return 0;
        }
        int[] sorted = values.stream().mapToInt(Integer::intValue).sorted().toArray();
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 0) {
            return (sorted[mid - 1] + sorted[mid]) / 2.0;
        }
        return sorted[mid];
    }

    /**
     * Population standard deviation; zero for fewer than two values.
     */
    public static double standardDeviation(List<Integer> values, double mean) {
        if (values.size() <= 1) {
            return 0;
        }
        double squaredDiffs = 0;
        for (int value : values) {
            squaredDiffs += (value - mean) * (value - mean);
        }
        return Math.sqrt(squaredDiffs / values.size());
    }

    /**
     * Count per scale point, index 0 being {@code scaleMin}. Out-of-scale values are ignored.
     */
    public static List<Integer> distribution(List<Integer> values, int scaleMin, int scaleMax) {
        int[] buckets = new int[Math.max(scaleMax - scaleMin + 1, 0)];
        for (int value : values) {
            int bucket = value - scaleMin;
            if (bucket >= 0 && bucket < buckets.length) {
                buckets[bucket]++;
            }
        }
        return Arrays.stream(buckets).boxed().toList();
    }

    /**
     * Maps a raw average onto [0, 1] over the metric scale, inverted when lower values are better.
     */
    public static double normalize(double average, int scaleMin, int scaleMax, boolean lowerIsBetter) {
        if (scaleMax == scaleMin) {
            return NEUTRAL_SCORE;
        }
        double range = scaleMax - scaleMin;
        return lowerIsBetter ? (scaleMax - average) / range : (average - scaleMin) / range;
    }

    public static MetricScore score(List<Integer> values, RankingMetric metric) {
        if (values.isEmpty()) {
            return new MetricScore(0, NEUTRAL_SCORE, 0, 0,
                    distribution(values, metric.getScaleMin(), metric.getScaleMax()), 0);
        }
        double mean = mean(values);
        return new MetricScore(
                mean,
                normalize(mean, metric.getScaleMin(), metric.getScaleMax(), metric.isLowerIsBetter()),
                median(values),
                standardDeviation(values, mean),
                distribution(values, metric.getScaleMin(), metric.getScaleMax()),
                values.size()
        );
    }

    /**
     * Weighted mean of normalized averages. Metrics without responses do not count.
     */
    public static double overallScore(List<MetricScore> scores, List<RankingMetric> metrics) {
        double weighted = 0;
        double totalWeight = 0;
        for (int i = 0; i < scores.size(); i++) {
            MetricScore score = scores.get(i);
            if (score.responseCount() == 0) {
                continue;
            }
            double weight = metrics.get(i).getWeight();
            weighted += score.normalizedAverage() * weight;
            totalWeight += weight;
        }
        return totalWeight > 0 ? weighted / totalWeight : 0;
    }

    public static ConsensusLevel consensus(List<MetricScore> scores, List<RankingMetric> metrics) {
        List<Double> stdDevs = new ArrayList<>();
        List<Integer> widths = new ArrayList<>();
        for (int i = 0; i < scores.size(); i++) {
            if (scores.get(i).responseCount() == 0) {
                continue;
            }
            stdDevs.add(scores.get(i).stdDev());
            widths.add(metrics.get(i).getScaleMax() - metrics.get(i).getScaleMin());
        }
        if (stdDevs.isEmpty()) {
            return ConsensusLevel.HIGH;
        }
        double avgStdDev = stdDevs.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double avgWidth = widths.stream().mapToInt(Integer::intValue).average().orElse(1);
        if (avgWidth <= 0) {
            return avgStdDev == 0 ? ConsensusLevel.HIGH : ConsensusLevel.LOW;
        }
        return ConsensusLevel.fromRelativeSpread(avgStdDev / avgWidth);
    }
}
