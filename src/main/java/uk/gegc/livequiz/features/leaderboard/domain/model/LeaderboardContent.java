package uk.gegc.livequiz.features.leaderboard.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Snapshot document. Field order and map iteration order are fixed so that
 * recomputing from unchanged data serializes to identical bytes.
 *
 * @param topPlayers     the first entries of the ranking
 * @param answerCounts   answers per option index for the question, zero-filled
 * @param playerRanks    rank of every participant, in rank order
 * @param playerStreaks  streak of every participant after the question, in rank order
 */
public record LeaderboardContent(
        int questionIndex,
        List<LeaderboardEntry> topPlayers,
        int totalPlayers,
        int totalAnswered,
        List<Integer> answerCounts,
        Map<String, PlayerRank> playerRanks,
        Map<String, Integer> playerStreaks
) {

    public record LeaderboardEntry(
            String participantId,
            String displayName,
            int rank,
            int score,
            int currentStreak,
            int lastQuestionPoints
    ) {
    }

    public record PlayerRank(int rank, int totalPlayers) {
    }
}
