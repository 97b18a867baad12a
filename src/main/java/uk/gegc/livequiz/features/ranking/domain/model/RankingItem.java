package uk.gegc.livequiz.features.ranking.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "ranking_items",
        uniqueConstraints = @UniqueConstraint(name = "uq_ranking_item_key", columnNames = {"session_id", "item_key"}))
public class RankingItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, updatable = false, length = 64)
    private String sessionId;

    @Column(name = "item_key", nullable = false, length = 64)
    private String itemKey;

    @Column(name = "item_text", nullable = false, length = 500)
    private String text;

    @Column(name = "description", length = 1000)
    private String description;

    // Only approved items can be rated and appear in results
    @Column(name = "approved", nullable = false)
    private boolean approved = true;

    @Column(name = "display_order", nullable = false)
    private int displayOrder;
}
