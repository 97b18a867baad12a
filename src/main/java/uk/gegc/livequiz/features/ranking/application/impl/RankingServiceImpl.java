package uk.gegc.livequiz.features.ranking.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.livequiz.features.ranking.api.dto.SubmitRatingsRequest;
import uk.gegc.livequiz.features.ranking.api.dto.SubmitRatingsRequest.RatingEntry;
import uk.gegc.livequiz.features.ranking.api.dto.SubmitRatingsResponse;
import uk.gegc.livequiz.features.ranking.application.RankingService;
import uk.gegc.livequiz.features.ranking.domain.model.ItemRating;
import uk.gegc.livequiz.features.ranking.domain.model.RankingItem;
import uk.gegc.livequiz.features.ranking.domain.model.RankingMetric;
import uk.gegc.livequiz.features.ranking.domain.repository.ItemRatingRepository;
import uk.gegc.livequiz.features.ranking.domain.repository.RankingItemRepository;
import uk.gegc.livequiz.features.ranking.domain.repository.RankingMetricRepository;
import uk.gegc.livequiz.features.session.application.SessionAccessService;
import uk.gegc.livequiz.features.session.domain.model.ActivityType;
import uk.gegc.livequiz.features.session.domain.model.LiveSession;
import uk.gegc.livequiz.features.session.domain.model.SessionState;
import uk.gegc.livequiz.features.session.domain.repository.ParticipantRepository;
import uk.gegc.livequiz.shared.exception.PreconditionFailedException;
import uk.gegc.livequiz.shared.exception.ResourceNotFoundException;
import uk.gegc.livequiz.shared.exception.ValidationException;
import uk.gegc.livequiz.shared.ratelimit.RateLimitService;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class RankingServiceImpl implements RankingService {

    static final String RATE_LIMIT_OPERATION = "submit-ratings";

    private final SessionAccessService sessionAccessService;
    private final ParticipantRepository participantRepository;
    private final RankingMetricRepository metricRepository;
    private final RankingItemRepository itemRepository;
    private final ItemRatingRepository ratingRepository;
    private final RateLimitService rateLimitService;
    private final Clock clock;

    @Override
    @Transactional
    public SubmitRatingsResponse submitRatings(String sessionId, SubmitRatingsRequest request) {
        rateLimitService.checkRateLimit(RATE_LIMIT_OPERATION, sessionId + ":" + request.participantId());

        LiveSession session = sessionAccessService.requireSession(sessionId);
        if (session.getActivityType() != ActivityType.RANKING) {
            throw new PreconditionFailedException("Session " + sessionId + " is not a ranking activity");
        }
        if (session.getState() != SessionState.QUESTION) {
            throw new PreconditionFailedException("Session " + sessionId + " is not accepting ratings");
        }
        participantRepository.findByIdAndSessionId(request.participantId(), sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Participant " + request.participantId()
                        + " not found in session " + sessionId));

        Map<String, RankingMetric> metrics = metricRepository.findBySessionIdOrderByDisplayOrderAscIdAsc(sessionId).stream()
                .collect(Collectors.toMap(RankingMetric::getMetricKey, Function.identity()));
        Map<String, RankingItem> items = itemRepository.findBySessionIdAndApprovedTrueOrderByDisplayOrderAscIdAsc(sessionId).stream()
                .collect(Collectors.toMap(RankingItem::getItemKey, Function.identity()));

        // Validate everything before writing anything
        for (RatingEntry entry : request.ratings()) {
            RankingMetric metric = metrics.get(entry.metricKey());
            if (metric == null) {
                throw new ResourceNotFoundException("Metric " + entry.metricKey() + " not found in session " + sessionId);
            }
            if (!items.containsKey(entry.itemKey())) {
                throw new ResourceNotFoundException("Item " + entry.itemKey() + " not found or not approved");
            }
            if (!metric.isWithinScale(entry.value())) {
                throw new ValidationException("Rating for " + entry.metricKey() + " must be between "
                        + metric.getScaleMin() + " and " + metric.getScaleMax());
            }
        }

        Instant now = clock.instant();
        for (RatingEntry entry : request.ratings()) {
            Long itemId = items.get(entry.itemKey()).getId();
            Long metricId = metrics.get(entry.metricKey()).getId();
            ItemRating rating = ratingRepository
                    .findByParticipantIdAndItemIdAndMetricId(request.participantId(), itemId, metricId)
                    .orElseGet(() -> {
                        ItemRating created = new ItemRating();
                        created.setSessionId(sessionId);
                        created.setParticipantId(request.participantId());
                        created.setItemId(itemId);
                        created.setMetricId(metricId);
                        return created;
                    });
            rating.setValue(entry.value());
            rating.setRatedAt(now);
            ratingRepository.save(rating);
        }

        log.debug("Recorded {} ratings from participant {} in session {}",
                request.ratings().size(), request.participantId(), sessionId);
        return new SubmitRatingsResponse(true, request.ratings().size());
    }
}
