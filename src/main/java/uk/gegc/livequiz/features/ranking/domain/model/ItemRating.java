package uk.gegc.livequiz.features.ranking.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * One participant's value for one item on one metric. Re-rating replaces the value.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "item_ratings",
        uniqueConstraints = @UniqueConstraint(name = "uq_item_rating",
                columnNames = {"participant_id", "item_id", "metric_id"}))
public class ItemRating {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, updatable = false, length = 64)
    private String sessionId;

    @Column(name = "participant_id", nullable = false, updatable = false, length = 64)
    private String participantId;

    @Column(name = "item_id", nullable = false, updatable = false)
    private Long itemId;

    @Column(name = "metric_id", nullable = false, updatable = false)
    private Long metricId;

    @Column(name = "rating_value", nullable = false)
    private int value;

    @Column(name = "rated_at", nullable = false)
    private Instant ratedAt;
}
