package uk.gegc.livequiz.features.ranking.application;

import uk.gegc.livequiz.features.ranking.api.dto.ComputeRankingResultsResponse;
import uk.gegc.livequiz.features.ranking.domain.model.RankingResultsContent;

public interface RankingResultsService {

    ComputeRankingResultsResponse computeRankingResults(String sessionId, String username);

    RankingResultsContent getRankingResults(String sessionId);
}
