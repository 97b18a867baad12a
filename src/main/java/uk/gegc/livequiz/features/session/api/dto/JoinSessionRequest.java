package uk.gegc.livequiz.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "JoinSessionRequest")
public record JoinSessionRequest(
        @Schema(description = "Name shown on the leaderboard", example = "Ada")
        @NotBlank(message = "displayName is required")
        @Size(max = 100, message = "displayName cannot exceed 100 characters")
        String displayName
) {
}
