package uk.gegc.livequiz.features.ranking.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.livequiz.features.ranking.domain.model.RankingItem;

import java.util.List;

public interface RankingItemRepository extends JpaRepository<RankingItem, Long> {

    List<RankingItem> findBySessionIdAndApprovedTrueOrderByDisplayOrderAscIdAsc(String sessionId);
}
