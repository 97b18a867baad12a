package uk.gegc.livequiz.features.answer.domain.model;

import java.util.List;

/**
 * The typed value a participant submitted for one question.
 * {@link NoAnswer} stands for a question that ran out of time without a choice.
 */
public sealed interface SubmissionPayload
        permits SubmissionPayload.ChoiceAnswer,
                SubmissionPayload.MultiChoiceAnswer,
                SubmissionPayload.SliderAnswer,
                SubmissionPayload.TextAnswer,
                SubmissionPayload.NoAnswer {

    record ChoiceAnswer(int index) implements SubmissionPayload {
    }

    /**
     * @param indices distinct option indices in ascending order
     */
    record MultiChoiceAnswer(List<Integer> indices) implements SubmissionPayload {
        public MultiChoiceAnswer {
            indices = indices.stream().distinct().sorted().toList();
        }
    }

    record SliderAnswer(double value) implements SubmissionPayload {
    }

    record TextAnswer(String text) implements SubmissionPayload {
    }

    record NoAnswer() implements SubmissionPayload {
    }
}
