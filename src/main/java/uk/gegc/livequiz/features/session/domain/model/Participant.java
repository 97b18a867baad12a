package uk.gegc.livequiz.features.session.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.livequiz.features.answer.domain.model.AnswerRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A player in a session.
 * <p>
 * {@code score} only grows and is written together with the {@link AnswerRecord} that earned it.
 * At most one answer record exists per question index (enforced by a unique constraint).
 * </p>
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "participants")
public class Participant {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "session_id", nullable = false, updatable = false, length = 64)
    private String sessionId;

    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;

    @Column(name = "score", nullable = false)
    private int score;

    @Column(name = "current_streak", nullable = false)
    private int currentStreak;

    @Column(name = "joined_at", nullable = false, updatable = false)
    private Instant joinedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @OneToMany(mappedBy = "participant", fetch = FetchType.LAZY)
    @OrderBy("questionIndex ASC")
    private List<AnswerRecord> answers = new ArrayList<>();
}
