package uk.gegc.livequiz.features.answer.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "SubmitAnswerResponse", description = "Authoritative scoring result for a submission")
public record SubmitAnswerResponse(
        @Schema(description = "Always true for a recorded answer", example = "true")
        boolean success,

        @Schema(description = "Whether the answer earned full credit", example = "true")
        @JsonProperty("isCorrect")
        boolean isCorrect,

        @Schema(description = "Whether the answer earned partial credit", example = "false")
        @JsonProperty("isPartiallyCorrect")
        boolean isPartiallyCorrect,

        @Schema(description = "Points awarded for this answer", example = "550")
        int points,

        @Schema(description = "Participant's total score after this answer", example = "2140")
        int newScore
) {
}
