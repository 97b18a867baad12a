package uk.gegc.livequiz.features.leaderboard.application;

import uk.gegc.livequiz.features.leaderboard.api.dto.LeaderboardSnapshotDto;
import uk.gegc.livequiz.features.leaderboard.api.dto.QuestionResultsResponse;

public interface LeaderboardAggregator {

    /**
     * Recomputes ranks, the answer distribution and streaks after a question and replaces the snapshot.
     * Idempotent: unchanged data yields an identical snapshot document.
     */
    QuestionResultsResponse computeQuestionResults(String sessionId, int questionIndex, String username);

    LeaderboardSnapshotDto getLeaderboard(String sessionId);
}
