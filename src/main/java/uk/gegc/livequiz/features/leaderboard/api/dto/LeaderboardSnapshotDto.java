package uk.gegc.livequiz.features.leaderboard.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.livequiz.features.leaderboard.domain.model.LeaderboardContent;

import java.time.Instant;

@Schema(name = "LeaderboardSnapshotDto", description = "Latest leaderboard snapshot of a session")
public record LeaderboardSnapshotDto(
        String sessionId,
        int questionIndex,
        Instant computedAt,
        LeaderboardContent content
) {
}
