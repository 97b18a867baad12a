package uk.gegc.livequiz.features.ranking.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Stored outcome of the last ranking computation for a session, one row per session.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "ranking_results")
public class RankingResults {

    @Id
    @Column(name = "session_id", nullable = false, updatable = false, length = 64)
    private String sessionId;

    @Column(name = "content", nullable = false, columnDefinition = "LONGTEXT")
    private String content;

    @Column(name = "computed_at", nullable = false)
    private Instant computedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;
}
