package uk.gegc.livequiz.features.ranking.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * JSON document stored in {@link RankingResults#getContent()}.
 */
public record RankingResultsContent(
        List<RankingItemResult> items,
        long totalParticipants,
        long participantsWhoRated
) {

    /**
     * One ranked item; {@code metricScores} is keyed by metric key in metric display order.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RankingItemResult(
            String itemId,
            String itemText,
            String itemDescription,
            double overallScore,
            int rank,
            Map<String, MetricScore> metricScores,
            ConsensusLevel consensusLevel
    ) {
    }

    public record MetricScore(
            double rawAverage,
            double normalizedAverage,
            double median,
            double stdDev,
            List<Integer> distribution,
            int responseCount
    ) {
    }
}
