package uk.gegc.livequiz.features.ranking.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A dimension items are rated on, with an integer scale and a weight in the overall score.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "ranking_metrics",
        uniqueConstraints = @UniqueConstraint(name = "uq_ranking_metric_key", columnNames = {"session_id", "metric_key"}))
public class RankingMetric {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, updatable = false, length = 64)
    private String sessionId;

    @Column(name = "metric_key", nullable = false, length = 64)
    private String metricKey;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "scale_min", nullable = false)
    private int scaleMin;

    @Column(name = "scale_max", nullable = false)
    private int scaleMax;

    @Column(name = "weight", nullable = false)
    private double weight = 1.0;

    @Column(name = "lower_is_better", nullable = false)
    private boolean lowerIsBetter;

    @Column(name = "display_order", nullable = false)
    private int displayOrder;

    public boolean isWithinScale(int value) {
        return value >= scaleMin && value <= scaleMax;
    }
}
