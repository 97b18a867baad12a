package uk.gegc.livequiz.features.answer.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(name = "LiveProgressDto", description = "Best-effort answer counters for the host view; may lag behind committed answers")
public record LiveProgressDto(
        @Schema(description = "Session identifier")
        String sessionId,

        @Schema(description = "Question index", example = "3")
        int questionIndex,

        @Schema(description = "Answers counted so far (timeouts excluded)", example = "17")
        int totalAnswered,

        @Schema(description = "Participants currently in the session", example = "24")
        long totalParticipants,

        @Schema(description = "Answers per option index")
        Map<Integer, Integer> answerCounts
) {
}
