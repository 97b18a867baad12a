package uk.gegc.livequiz.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(name = "ParticipantDto")
public record ParticipantDto(
        @Schema(description = "Participant identifier; send it with every answer")
        String id,
        String sessionId,
        String displayName,
        int score,
        int currentStreak,
        Instant joinedAt
) {
}
