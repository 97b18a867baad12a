package uk.gegc.livequiz.features.session.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * One live run of a quiz, poll or rating activity.
 * <p>
 * Mutated only through host transitions. {@code currentQuestionIndex} never moves backwards
 * while the session is active and {@code questionStartTime} anchors the answer window
 * of the current question.
 * </p>
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "live_sessions")
public class LiveSession {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "host_id", nullable = false, updatable = false)
    private String hostId;

    @Column(name = "title")
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(name = "activity_type", nullable = false, updatable = false, length = 20)
    private ActivityType activityType;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private SessionState state;

    @Column(name = "current_question_index", nullable = false)
    private int currentQuestionIndex;

    @Column(name = "question_start_time")
    private Instant questionStartTime;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public boolean isHostedBy(String userId) {
        return hostId != null && hostId.equals(userId);
    }

    public boolean acceptsAnswersFor(int questionIndex) {
        return state == SessionState.QUESTION && currentQuestionIndex == questionIndex;
    }
}
