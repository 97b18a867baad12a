package uk.gegc.livequiz.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import uk.gegc.livequiz.features.question.domain.model.QuestionType;

import java.util.List;

@Schema(name = "AnswerKeyRequest", description = "One question of a session together with its correctness rules. Never returned to participants.")
public record AnswerKeyRequest(
        @Schema(description = "Question type", example = "SINGLE_CHOICE")
        @NotNull(message = "questionType is required")
        QuestionType questionType,

        @Schema(description = "Seconds participants have to answer; defaults to 20", example = "20")
        @Positive(message = "timeLimitSeconds must be positive")
        @Max(value = 600, message = "timeLimitSeconds cannot exceed 600")
        Integer timeLimitSeconds,

        @Schema(description = "Question text", example = "What is the capital of France?")
        @Size(max = 1000, message = "questionText is too long")
        String questionText,

        @Schema(description = "Option labels for choice and poll questions", example = "[\"Paris\", \"Lyon\", \"Nice\"]")
        List<@Size(max = 500) String> optionLabels,

        @Schema(description = "Correct option for SINGLE_CHOICE", example = "0")
        Integer correctIndex,

        @Schema(description = "Correct options for MULTIPLE_CHOICE", example = "[0, 2]")
        List<Integer> correctIndices,

        @Schema(description = "Correct value for SLIDER", example = "42")
        Double correctValue,

        @Schema(description = "Lower bound for SLIDER", example = "0")
        Double minValue,

        @Schema(description = "Upper bound for SLIDER", example = "100")
        Double maxValue,

        @Schema(description = "Full-credit tolerance for SLIDER; defaults to 10% of the range", example = "5")
        Double acceptableError,

        @Schema(description = "Expected answer for FREE_RESPONSE", example = "Paris")
        @Size(max = 500, message = "correctText is too long")
        String correctText,

        @Schema(description = "Other accepted answers for FREE_RESPONSE", example = "[\"Paree\"]")
        List<@Size(max = 500) String> alternativeAnswers,

        @Schema(description = "Compare FREE_RESPONSE answers case-sensitively; defaults to false")
        Boolean caseSensitive,

        @Schema(description = "Accept near-miss spellings for FREE_RESPONSE; defaults to true")
        Boolean allowTypos
) {
}
