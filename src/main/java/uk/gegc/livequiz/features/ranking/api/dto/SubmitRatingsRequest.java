package uk.gegc.livequiz.features.ranking.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

@Schema(name = "SubmitRatingsRequest", description = "A participant's ratings of ranking items")
public record SubmitRatingsRequest(
        @Schema(description = "Participant identifier returned on join", example = "4b9c7c1e-2d3f-4a51-9d8e-0f5b6a7c8d9e")
        @NotBlank(message = "participantId is required")
        String participantId,

        @NotEmpty(message = "At least one rating is required")
        @Size(max = 500, message = "Too many ratings in one request")
        List<@Valid @NotNull RatingEntry> ratings
) {

    @Schema(name = "RatingEntry")
    public record RatingEntry(
            @Schema(example = "idea-1")
            @NotBlank(message = "itemKey is required")
            String itemKey,

            @Schema(example = "impact")
            @NotBlank(message = "metricKey is required")
            String metricKey,

            @Schema(example = "4")
            @NotNull(message = "value is required")
            Integer value
    ) {
    }
}
