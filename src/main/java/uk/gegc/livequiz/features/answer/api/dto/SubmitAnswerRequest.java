package uk.gegc.livequiz.features.answer.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.livequiz.features.answer.application.AnswerValidator;
import uk.gegc.livequiz.features.question.domain.model.QuestionType;

import java.util.List;

@Schema(name = "SubmitAnswerRequest", description = "A participant's answer to the current question. Exactly one answer field is set unless timedOut is true.")
public record SubmitAnswerRequest(
        @Schema(description = "Participant identifier returned when joining", example = "5b0f3c1e-7d4c-4a55-9a43-0c2f0e6a1d11")
        @NotBlank(message = "participantId is required")
        String participantId,

        @Schema(description = "Zero-based index of the question being answered", example = "3")
        @NotNull(message = "questionIndex is required")
        @Min(value = 0, message = "questionIndex must be non-negative")
        Integer questionIndex,

        @Schema(description = "Question type the client rendered", example = "SINGLE_CHOICE")
        @NotNull(message = "questionType is required")
        QuestionType questionType,

        @Schema(description = "Seconds left on the client's countdown", example = "12.4")
        @NotNull(message = "timeRemaining is required")
        Double timeRemaining,

        @Schema(description = "Chosen option for single-choice and poll-single questions", example = "2")
        Integer answerIndex,

        @Schema(description = "Chosen options for multiple-choice and poll-multiple questions", example = "[0, 2]")
        List<Integer> answerIndices,

        @Schema(description = "Chosen value for slider questions", example = "42.5")
        Double sliderValue,

        @Schema(description = "Typed answer for free-response and free-text poll questions", example = "Paris")
        @Size(max = AnswerValidator.MAX_TEXT_LENGTH, message = "textAnswer cannot exceed 200 characters")
        String textAnswer,

        @Schema(description = "True when the countdown expired without an answer", example = "false")
        Boolean timedOut
) {
}
