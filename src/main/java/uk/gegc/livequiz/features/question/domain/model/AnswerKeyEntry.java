package uk.gegc.livequiz.features.question.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.livequiz.shared.persistence.IntegerListConverter;
import uk.gegc.livequiz.shared.persistence.StringListConverter;

import java.util.ArrayList;
import java.util.List;

/**
 * Server-only correctness rules for one question of a session.
 * Written once when the session is created and never exposed to participants.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "answer_key_entries",
        uniqueConstraints = @UniqueConstraint(name = "uq_answer_key_session_question",
                columnNames = {"session_id", "question_index"}))
public class AnswerKeyEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, updatable = false, length = 64)
    private String sessionId;

    @Column(name = "question_index", nullable = false, updatable = false)
    private int questionIndex;

    @Enumerated(EnumType.STRING)
    @Column(name = "question_type", nullable = false, updatable = false, length = 32)
    private QuestionType questionType;

    @Column(name = "time_limit_seconds", nullable = false)
    private int timeLimitSeconds;

    @Column(name = "question_text", length = 1000)
    private String questionText;

    @Convert(converter = StringListConverter.class)
    @Column(name = "option_labels")
    private List<String> optionLabels = new ArrayList<>();

    // SINGLE_CHOICE
    @Column(name = "correct_index")
    private Integer correctIndex;

    // MULTIPLE_CHOICE
    @Convert(converter = IntegerListConverter.class)
    @Column(name = "correct_indices")
    private List<Integer> correctIndices;

    // SLIDER
    @Column(name = "correct_value")
    private Double correctValue;

    @Column(name = "min_value")
    private Double minValue;

    @Column(name = "max_value")
    private Double maxValue;

    @Column(name = "acceptable_error")
    private Double acceptableError;

    // FREE_RESPONSE
    @Column(name = "correct_text", length = 500)
    private String correctText;

    @Convert(converter = StringListConverter.class)
    @Column(name = "alternative_answers")
    private List<String> alternativeAnswers = new ArrayList<>();

    @Column(name = "case_sensitive", nullable = false)
    private boolean caseSensitive;

    @Column(name = "allow_typos", nullable = false)
    private boolean allowTypos = true;

    public int optionCount() {
        return optionLabels == null ? 0 : optionLabels.size();
    }
}
