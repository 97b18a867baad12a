package uk.gegc.livequiz.features.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.livequiz.features.analytics.domain.model.SessionAnalyticsReport.AnalyticsSummary;

@Schema(name = "ComputeAnalyticsResponse", description = "Summary of freshly computed session analytics; the full report is available via GET")
public record ComputeAnalyticsResponse(
        @Schema(example = "true")
        boolean success,
        AnalyticsSummary summary
) {
}
