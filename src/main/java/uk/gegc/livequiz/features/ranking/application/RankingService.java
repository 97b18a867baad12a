package uk.gegc.livequiz.features.ranking.application;

import uk.gegc.livequiz.features.ranking.api.dto.SubmitRatingsRequest;
import uk.gegc.livequiz.features.ranking.api.dto.SubmitRatingsResponse;

public interface RankingService {

    /**
     * Records or replaces a participant's ratings for the open rating round of a ranking session.
     *
     * @throws uk.gegc.livequiz.shared.exception.ResourceNotFoundException if the session, participant, item or metric is unknown
     * @throws uk.gegc.livequiz.shared.exception.PreconditionFailedException if the session is not a ranking session accepting ratings
     * @throws uk.gegc.livequiz.shared.exception.ValidationException if a value is outside its metric's scale
     */
    SubmitRatingsResponse submitRatings(String sessionId, SubmitRatingsRequest request);
}
