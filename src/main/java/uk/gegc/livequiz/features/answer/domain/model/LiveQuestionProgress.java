package uk.gegc.livequiz.features.answer.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.livequiz.shared.persistence.OptionCountsConverter;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Host-side progress counters for the question being answered.
 * <p>
 * Updated after each committed answer on a best-effort basis. May lag behind or miss updates;
 * the leaderboard snapshot is the authoritative distribution.
 * </p>
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "live_question_progress",
        uniqueConstraints = @UniqueConstraint(name = "uq_progress_session_question",
                columnNames = {"session_id", "question_index"}))
public class LiveQuestionProgress {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, updatable = false, length = 64)
    private String sessionId;

    @Column(name = "question_index", nullable = false, updatable = false)
    private int questionIndex;

    @Column(name = "total_answered", nullable = false)
    private int totalAnswered;

    @Convert(converter = OptionCountsConverter.class)
    @Column(name = "answer_counts", nullable = false)
    private Map<Integer, Integer> answerCounts = new TreeMap<>();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public void increment(Iterable<Integer> optionIndices) {
        Map<Integer, Integer> counts = new TreeMap<>(answerCounts);
        for (Integer index : optionIndices) {
            counts.merge(index, 1, Integer::sum);
        }
        this.answerCounts = counts;
        this.totalAnswered++;
    }
}
