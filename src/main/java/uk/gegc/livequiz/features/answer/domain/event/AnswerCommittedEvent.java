package uk.gegc.livequiz.features.answer.domain.event;

import org.springframework.context.ApplicationEvent;

import java.util.List;

/**
 * Published inside the answer commit transaction; listeners act after commit.
 * {@code optionIndices} is empty for slider, text and timed-out answers.
 */
public class AnswerCommittedEvent extends ApplicationEvent {

    private final String sessionId;
    private final String participantId;
    private final int questionIndex;
    private final List<Integer> optionIndices;
    private final boolean timedOut;

    public AnswerCommittedEvent(Object source, String sessionId, String participantId, int questionIndex,
                                List<Integer> optionIndices, boolean timedOut) {
        super(source);
        this.sessionId = sessionId;
        this.participantId = participantId;
        this.questionIndex = questionIndex;
        this.optionIndices = List.copyOf(optionIndices);
        this.timedOut = timedOut;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getParticipantId() {
        return participantId;
    }

    public int getQuestionIndex() {
        return questionIndex;
    }

    public List<Integer> getOptionIndices() {
        return optionIndices;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
