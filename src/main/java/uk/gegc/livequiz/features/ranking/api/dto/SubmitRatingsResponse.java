package uk.gegc.livequiz.features.ranking.api.dto;

public record SubmitRatingsResponse(boolean success, int ratingsRecorded) {
}
