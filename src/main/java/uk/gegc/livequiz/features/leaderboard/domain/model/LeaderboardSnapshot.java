package uk.gegc.livequiz.features.leaderboard.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * The authoritative ranked view of a session, replaced wholesale after each question.
 * {@code content} is a serialized {@link LeaderboardContent}; {@code computedAt} is row metadata only.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "leaderboard_snapshots")
public class LeaderboardSnapshot {

    @Id
    @Column(name = "session_id", nullable = false, updatable = false, length = 64)
    private String sessionId;

    @Column(name = "question_index", nullable = false)
    private int questionIndex;

    @Column(name = "content", nullable = false, columnDefinition = "LONGTEXT")
    private String content;

    @Column(name = "computed_at", nullable = false)
    private Instant computedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;
}
