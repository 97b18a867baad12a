package uk.gegc.livequiz.features.ranking.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.livequiz.features.ranking.domain.model.RankingMetric;

import java.util.List;

public interface RankingMetricRepository extends JpaRepository<RankingMetric, Long> {

    List<RankingMetric> findBySessionIdOrderByDisplayOrderAscIdAsc(String sessionId);
}
