package uk.gegc.livequiz.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import uk.gegc.livequiz.features.session.domain.model.SessionState;

@Schema(name = "TransitionStateRequest", description = "Host command moving the session to another state")
public record TransitionStateRequest(
        @Schema(description = "Target state", example = "QUESTION")
        @NotNull(message = "state is required")
        SessionState state,

        @Schema(description = "Question to move to; defaults to the current question", example = "1")
        @Min(value = 0, message = "questionIndex must be non-negative")
        Integer questionIndex
) {
}
