package uk.gegc.livequiz.features.answer.application;

import org.springframework.stereotype.Component;
import uk.gegc.livequiz.features.answer.api.dto.SubmitAnswerRequest;
import uk.gegc.livequiz.features.answer.domain.model.SubmissionPayload;
import uk.gegc.livequiz.features.question.domain.model.AnswerKeyEntry;
import uk.gegc.livequiz.shared.result.ErrorKind;
import uk.gegc.livequiz.shared.result.Result;

import java.util.List;

/**
 * Turns a raw submission into a typed {@link SubmissionPayload}, or an {@code INVALID_ARGUMENT} failure.
 * <p>
 * Runs before any state is read for writing, so a rejected submission never touches the database.
 * </p>
 */
@Component
public class AnswerValidator {

    public static final int MAX_TEXT_LENGTH = 200;

    /**
     * Checks that do not need the answer key.
     */
    public Result<SubmitAnswerRequest> validateRequest(SubmitAnswerRequest request) {
        if (request == null) {
            return invalid("Submission is required");
        }
        if (request.participantId() == null || request.participantId().isBlank()) {
            return invalid("participantId is required");
        }
        if (request.questionIndex() == null || request.questionIndex() < 0) {
            return invalid("questionIndex must be a non-negative integer");
        }
        if (request.questionType() == null) {
            return invalid("questionType is required");
        }
        Double timeRemaining = request.timeRemaining();
        if (timeRemaining == null || timeRemaining.isNaN() || timeRemaining.isInfinite()) {
            return invalid("timeRemaining is required");
        }
        if (timeRemaining < 0) {
            return invalid("timeRemaining cannot be negative");
        }
        return Result.success(request);
    }

    /**
     * Checks the submission against the question it answers and extracts the payload.
     */
    public Result<SubmissionPayload> validate(SubmitAnswerRequest request, AnswerKeyEntry key) {
        if (request.timeRemaining() > key.getTimeLimitSeconds()) {
            return invalid("timeRemaining cannot exceed the question time limit of "
                    + key.getTimeLimitSeconds() + " seconds");
        }
        if (request.questionType() != key.getQuestionType()) {
            return invalid("Question " + key.getQuestionIndex() + " is " + key.getQuestionType()
                    + ", not " + request.questionType());
        }

        int present = countPayloadFields(request);
        if (Boolean.TRUE.equals(request.timedOut())) {
            if (present > 0) {
                return invalid("A timed-out submission cannot carry an answer");
            }
            return Result.success(new SubmissionPayload.NoAnswer());
        }
        if (present == 0) {
            return invalid("An answer is required");
        }
        if (present > 1) {
            return invalid("Exactly one answer field may be set");
        }

        return switch (key.getQuestionType()) {
            case SINGLE_CHOICE, POLL_SINGLE -> validateChoice(request.answerIndex(), key);
            case MULTIPLE_CHOICE -> validateMultiChoice(request.answerIndices(), key, true);
            case POLL_MULTIPLE -> validateMultiChoice(request.answerIndices(), key, false);
            case SLIDER -> validateSlider(request.sliderValue(), key);
            case FREE_RESPONSE -> validateText(request.textAnswer(), true);
            case POLL_FREE_TEXT -> validateText(request.textAnswer(), false);
        };
    }

    private Result<SubmissionPayload> validateChoice(Integer index, AnswerKeyEntry key) {
        if (index == null) {
            return invalid("answerIndex is required for " + key.getQuestionType());
        }
        if (!isValidOption(index, key)) {
            return invalid("answerIndex " + index + " is not a valid option");
        }
        return Result.success(new SubmissionPayload.ChoiceAnswer(index));
    }

    private Result<SubmissionPayload> validateMultiChoice(List<Integer> indices, AnswerKeyEntry key, boolean allowEmpty) {
        if (indices == null) {
            return invalid("answerIndices is required for " + key.getQuestionType());
        }
        if (indices.isEmpty() && !allowEmpty) {
            return invalid("Select at least one option");
        }
        for (Integer index : indices) {
            if (index == null || !isValidOption(index, key)) {
                return invalid("answerIndices contains an invalid option: " + index);
            }
        }
        return Result.success(new SubmissionPayload.MultiChoiceAnswer(indices));
    }

    private Result<SubmissionPayload> validateSlider(Double value, AnswerKeyEntry key) {
        if (value == null) {
            return invalid("sliderValue is required for SLIDER");
        }
        if (value.isNaN() || value.isInfinite()) {
            return invalid("sliderValue must be a finite number");
        }
        if (key.getMinValue() != null && value < key.getMinValue()
                || key.getMaxValue() != null && value > key.getMaxValue()) {
            return invalid("sliderValue must be between " + key.getMinValue() + " and " + key.getMaxValue());
        }
        return Result.success(new SubmissionPayload.SliderAnswer(value));
    }

    private Result<SubmissionPayload> validateText(String text, boolean allowBlank) {
        if (text == null) {
            return invalid("textAnswer is required");
        }
        if (text.length() > MAX_TEXT_LENGTH) {
            return invalid("textAnswer cannot exceed " + MAX_TEXT_LENGTH + " characters");
        }
        if (!allowBlank && text.isBlank()) {
            return invalid("textAnswer cannot be blank");
        }
        return Result.success(new SubmissionPayload.TextAnswer(text));
    }

    private boolean isValidOption(int index, AnswerKeyEntry key) {
        if (index < 0) {
            return false;
        }
        // Keys written without labels only bound the index from below
        return key.optionCount() == 0 || index < key.optionCount();
    }

    private int countPayloadFields(SubmitAnswerRequest request) {
        int count = 0;
        if (request.answerIndex() != null) count++;
        if (request.answerIndices() != null) count++;
        if (request.sliderValue() != null) count++;
        if (request.textAnswer() != null) count++;
        return count;
    }

    private static <T> Result<T> invalid(String message) {
        return Result.failure(ErrorKind.INVALID_ARGUMENT, message);
    }
}
