package uk.gegc.livequiz.features.ranking.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "ComputeRankingResultsResponse")
public record ComputeRankingResultsResponse(
        boolean success,
        @Schema(description = "Number of ranked items") int totalItems,
        @Schema(description = "Participants who submitted at least one rating") long participantsWhoRated
) {
}
