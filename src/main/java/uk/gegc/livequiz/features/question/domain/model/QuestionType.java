package uk.gegc.livequiz.features.question.domain.model;

public enum QuestionType {
    SINGLE_CHOICE,
    MULTIPLE_CHOICE,
    SLIDER,
    FREE_RESPONSE,
    POLL_SINGLE,
    POLL_MULTIPLE,
    POLL_FREE_TEXT;

    public boolean isPoll() {
        return this == POLL_SINGLE || this == POLL_MULTIPLE || this == POLL_FREE_TEXT;
    }

    public boolean isScored() {
        return !isPoll();
    }

    /**
     * Whether answers are option indices and therefore contribute to the per-option distribution.
     */
    public boolean hasOptions() {
        return this == SINGLE_CHOICE || this == MULTIPLE_CHOICE || this == POLL_SINGLE || this == POLL_MULTIPLE;
    }
}
