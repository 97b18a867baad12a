package uk.gegc.livequiz.features.ranking.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.livequiz.features.ranking.domain.model.RankingResults;

public interface RankingResultsRepository extends JpaRepository<RankingResults, String> {
}
