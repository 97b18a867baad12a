package uk.gegc.livequiz.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

@Schema(name = "RankingMetricRequest", description = "A dimension items are rated on")
public record RankingMetricRequest(
        @Schema(description = "Stable key of the metric", example = "impact")
        @NotBlank(message = "metricKey is required")
        @Size(max = 64)
        String metricKey,

        @Schema(description = "Display name", example = "Impact")
        @NotBlank(message = "name is required")
        @Size(max = 255)
        String name,

        @Schema(description = "Lowest value of the scale", example = "1")
        @NotNull(message = "scaleMin is required")
        Integer scaleMin,

        @Schema(description = "Highest value of the scale", example = "5")
        @NotNull(message = "scaleMax is required")
        Integer scaleMax,

        @Schema(description = "Weight in the overall score; defaults to 1", example = "1.0")
        @Positive(message = "weight must be positive")
        Double weight,

        @Schema(description = "Whether lower ratings are better (e.g. effort)", example = "false")
        Boolean lowerIsBetter
) {
}
