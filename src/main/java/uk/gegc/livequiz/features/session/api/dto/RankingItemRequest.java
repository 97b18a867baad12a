package uk.gegc.livequiz.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "RankingItemRequest", description = "An item participants rate")
public record RankingItemRequest(
        @Schema(description = "Stable key of the item", example = "idea-1")
        @NotBlank(message = "itemKey is required")
        @Size(max = 64)
        String itemKey,

        @Schema(description = "Item text", example = "Offer a four-day work week")
        @NotBlank(message = "text is required")
        @Size(max = 500)
        String text,

        @Schema(description = "Optional description")
        @Size(max = 1000)
        String description,

        @Schema(description = "Whether the item is shown for rating; defaults to true")
        Boolean approved
) {
}
