package uk.gegc.livequiz.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.livequiz.features.session.domain.model.ActivityType;

import java.util.List;

@Schema(name = "CreateSessionRequest", description = "A new live session with its answer key, or its metrics and items for a ranking activity")
public record CreateSessionRequest(
        @Schema(description = "Session title", example = "Friday geography quiz")
        @NotBlank(message = "title is required")
        @Size(max = 255, message = "title is too long")
        String title,

        @Schema(description = "Activity type", example = "QUIZ")
        @NotNull(message = "activityType is required")
        ActivityType activityType,

        @Schema(description = "Questions in play order; index 0 is the first question")
        @Size(max = 200, message = "A session can have at most 200 questions")
        List<@Valid AnswerKeyRequest> questions,

        @Schema(description = "Rating metrics (RANKING only)")
        @Size(max = 10, message = "A session can have at most 10 metrics")
        List<@Valid RankingMetricRequest> metrics,

        @Schema(description = "Items to rate (RANKING only)")
        @Size(max = 200, message = "A session can have at most 200 items")
        List<@Valid RankingItemRequest> items
) {
}
