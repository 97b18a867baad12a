package uk.gegc.livequiz.features.analytics.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import uk.gegc.livequiz.features.question.domain.model.QuestionType;

import java.util.List;

/**
 * Post-session analytics: per-question statistics, the final leaderboard,
 * rank history of leading participants, a score histogram and a summary.
 * Rates are percentages in {@code [0, 100]}.
 */
public record SessionAnalyticsReport(
        String sessionId,
        String title,
        int totalQuestions,
        int totalPlayers,
        List<QuestionStats> questionStats,
        List<PositionHistoryEntry> positionHistory,
        List<ScoreBin> scoreDistribution,
        List<PlayerStats> fullLeaderboard,
        AnalyticsSummary summary
) {

    /**
     * @param totalTimeout participants without an answer submitted in time
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record QuestionStats(
            int questionIndex,
            QuestionType questionType,
            String questionText,
            int totalAnswered,
            int totalTimeout,
            double timeoutRate,
            double responseRate,
            int correctCount,
            double correctRate,
            double avgPoints,
            List<OptionStat> answerDistribution,
            SliderStats sliderDistribution,
            List<TextGroup> freeResponseDistribution
    ) {
    }

    public record OptionStat(String label, int count, double percentage, @JsonProperty("isCorrect") boolean isCorrect) {
    }

    public record SliderStats(Double correctValue, Double minValue, Double maxValue, List<Double> values) {
    }

    public record TextGroup(String text, int count, @JsonProperty("isCorrect") boolean isCorrect) {
    }

    public record PlayerStats(
            String participantId,
            String displayName,
            int rank,
            int finalScore,
            int correctAnswers,
            int totalAnswered,
            int timeouts,
            double accuracy,
            int longestStreak
    ) {
    }

    /**
     * @param positions rank after each question, in question order
     */
    public record PositionHistoryEntry(String participantId, String displayName, List<Integer> positions, int finalScore) {
    }

    public record ScoreBin(int minScore, int maxScore, int count) {
    }

    public record QuestionRate(int questionIndex, double correctRate) {
    }

    public record AnalyticsSummary(
            int totalPlayers,
            int totalQuestions,
            QuestionRate hardestQuestion,
            QuestionRate easiestQuestion,
            double avgScore,
            double avgAccuracy,
            double avgTimeoutRate
    ) {
    }
}
