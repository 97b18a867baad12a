package uk.gegc.livequiz.features.leaderboard.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "QuestionResultsResponse", description = "Outcome of recomputing the leaderboard after a question")
public record QuestionResultsResponse(
        @Schema(example = "true")
        boolean success,

        @Schema(description = "Question the snapshot reflects", example = "3")
        int questionIndex,

        @Schema(description = "Participants ranked", example = "24")
        int totalPlayers,

        @Schema(description = "Participants who answered the question before time ran out", example = "21")
        int totalAnswered
) {
}
