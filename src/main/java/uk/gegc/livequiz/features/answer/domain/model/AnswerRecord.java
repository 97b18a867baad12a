package uk.gegc.livequiz.features.answer.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.livequiz.features.question.domain.model.QuestionType;
import uk.gegc.livequiz.features.session.domain.model.Participant;
import uk.gegc.livequiz.shared.persistence.IntegerListConverter;

import java.time.Instant;
import java.util.List;

/**
 * Append-once record of a participant's scored response to one question.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "answer_records",
        uniqueConstraints = @UniqueConstraint(name = "uq_answer_participant_question",
                columnNames = {"participant_id", "question_index"}))
public class AnswerRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "participant_id", nullable = false, updatable = false)
    private Participant participant;

    @Column(name = "question_index", nullable = false, updatable = false)
    private int questionIndex;

    @Enumerated(EnumType.STRING)
    @Column(name = "question_type", nullable = false, updatable = false, length = 32)
    private QuestionType questionType;

    @Column(name = "answer_index", updatable = false)
    private Integer answerIndex;

    @Convert(converter = IntegerListConverter.class)
    @Column(name = "answer_indices", updatable = false)
    private List<Integer> answerIndices;

    @Column(name = "slider_value", updatable = false)
    private Double sliderValue;

    @Column(name = "text_answer", length = 500, updatable = false)
    private String textAnswer;

    @Column(name = "time_remaining", nullable = false, updatable = false)
    private double timeRemaining;

    @Column(name = "answered_at", nullable = false, updatable = false)
    private Instant answeredAt;

    @Column(name = "points", nullable = false, updatable = false)
    private int points;

    @Column(name = "is_correct", nullable = false, updatable = false)
    private boolean correct;

    @Column(name = "is_partially_correct", nullable = false, updatable = false)
    private boolean partiallyCorrect;

    @Column(name = "timed_out", nullable = false, updatable = false)
    private boolean timedOut;

    public void applyPayload(SubmissionPayload payload) {
        if (payload instanceof SubmissionPayload.ChoiceAnswer choice) {
            this.answerIndex = choice.index();
        } else if (payload instanceof SubmissionPayload.MultiChoiceAnswer multi) {
            this.answerIndices = multi.indices();
        } else if (payload instanceof SubmissionPayload.SliderAnswer slider) {
            this.sliderValue = slider.value();
        } else if (payload instanceof SubmissionPayload.TextAnswer text) {
            this.textAnswer = text.text();
        } else {
            this.timedOut = true;
        }
    }
}
