package uk.gegc.livequiz.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.livequiz.features.session.domain.model.ActivityType;
import uk.gegc.livequiz.features.session.domain.model.SessionState;

import java.time.Instant;

@Schema(name = "SessionDto", description = "Public view of a session; the answer key is never included")
public record SessionDto(
        String id,
        String hostId,
        String title,
        ActivityType activityType,
        SessionState state,
        int currentQuestionIndex,
        Instant questionStartTime,
        long questionCount,
        long participantCount,
        Instant createdAt
) {
}
