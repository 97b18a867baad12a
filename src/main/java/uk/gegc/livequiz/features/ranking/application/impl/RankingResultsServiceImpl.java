package uk.gegc.livequiz.features.ranking.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.livequiz.features.ranking.api.dto.ComputeRankingResultsResponse;
import uk.gegc.livequiz.features.ranking.application.RankingResultsService;
import uk.gegc.livequiz.features.ranking.application.RankingStatistics;
import uk.gegc.livequiz.features.ranking.domain.model.ItemRating;
import uk.gegc.livequiz.features.ranking.domain.model.RankingItem;
import uk.gegc.livequiz.features.ranking.domain.model.RankingMetric;
import uk.gegc.livequiz.features.ranking.domain.model.RankingResults;
import uk.gegc.livequiz.features.ranking.domain.model.RankingResultsContent;
import uk.gegc.livequiz.features.ranking.domain.model.RankingResultsContent.MetricScore;
import uk.gegc.livequiz.features.ranking.domain.model.RankingResultsContent.RankingItemResult;
import uk.gegc.livequiz.features.ranking.domain.repository.ItemRatingRepository;
import uk.gegc.livequiz.features.ranking.domain.repository.RankingItemRepository;
import uk.gegc.livequiz.features.ranking.domain.repository.RankingMetricRepository;
import uk.gegc.livequiz.features.ranking.domain.repository.RankingResultsRepository;
import uk.gegc.livequiz.features.session.application.SessionAccessService;
import uk.gegc.livequiz.features.session.domain.model.ActivityType;
import uk.gegc.livequiz.features.session.domain.model.LiveSession;
import uk.gegc.livequiz.features.session.domain.model.SessionState;
import uk.gegc.livequiz.features.session.domain.repository.LiveSessionRepository;
import uk.gegc.livequiz.features.session.domain.repository.ParticipantRepository;
import uk.gegc.livequiz.shared.exception.PreconditionFailedException;
import uk.gegc.livequiz.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.util.*;

/**
 * Aggregates item ratings into per-metric statistics and a weighted overall ranking.
 * <p>
 * Ratings are normalized per metric onto [0, 1] so metrics on different scales can be combined;
 * a metric marked lower-is-better is inverted before weighting.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RankingResultsServiceImpl implements RankingResultsService {

    private static final Comparator<ScoredItem> RANKING_ORDER = Comparator
            .comparingDouble(ScoredItem::overallScore).reversed()
            .thenComparingInt(scored -> scored.item().getDisplayOrder())
            .thenComparing(scored -> scored.item().getId());

    private final SessionAccessService sessionAccessService;
    private final LiveSessionRepository sessionRepository;
    private final ParticipantRepository participantRepository;
    private final RankingMetricRepository metricRepository;
    private final RankingItemRepository itemRepository;
    private final ItemRatingRepository ratingRepository;
    private final RankingResultsRepository resultsRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional
    public ComputeRankingResultsResponse computeRankingResults(String sessionId, String username) {
        LiveSession session = sessionAccessService.requireHostedSession(sessionId, username);
        if (session.getActivityType() != ActivityType.RANKING) {
            throw new PreconditionFailedException("Session " + sessionId + " is not a ranking activity");
        }

        List<RankingItem> items = itemRepository.findBySessionIdAndApprovedTrueOrderByDisplayOrderAscIdAsc(sessionId);
        if (items.isEmpty()) {
            throw new PreconditionFailedException("Session " + sessionId + " has no approved items to rank");
        }
        List<RankingMetric> metrics = metricRepository.findBySessionIdOrderByDisplayOrderAscIdAsc(sessionId);

        // itemId -> metricId -> values
        Map<Long, Map<Long, List<Integer>>> valuesByItem = new HashMap<>();
        for (ItemRating rating : ratingRepository.findBySessionId(sessionId)) {
            valuesByItem.computeIfAbsent(rating.getItemId(), id -> new HashMap<>())
                    .computeIfAbsent(rating.getMetricId(), id -> new ArrayList<>())
                    .add(rating.getValue());
        }

        List<ScoredItem> scored = new ArrayList<>(items.size());
        for (RankingItem item : items) {
            Map<Long, List<Integer>> byMetric = valuesByItem.getOrDefault(item.getId(), Map.of());
            List<MetricScore> scores = new ArrayList<>(metrics.size());
            for (RankingMetric metric : metrics) {
                scores.add(RankingStatistics.score(byMetric.getOrDefault(metric.getId(), List.of()), metric));
            }
            scored.add(new ScoredItem(item, scores, RankingStatistics.overallScore(scores, metrics)));
        }
        scored.sort(RANKING_ORDER);

        List<RankingItemResult> results = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            ScoredItem entry = scored.get(i);
            Map<String, MetricScore> metricScores = new LinkedHashMap<>();
            for (int m = 0; m < metrics.size(); m++) {
                metricScores.put(metrics.get(m).getMetricKey(), entry.scores().get(m));
            }
            results.add(new RankingItemResult(
                    entry.item().getItemKey(),
                    entry.item().getText(),
                    entry.item().getDescription(),
                    entry.overallScore(),
                    i + 1,
                    metricScores,
                    RankingStatistics.consensus(entry.scores(), metrics)
            ));
        }

        long participantsWhoRated = ratingRepository.countRaters(sessionId);
        RankingResultsContent content = new RankingResultsContent(
                results,
                participantRepository.countBySessionId(sessionId),
                participantsWhoRated
        );

        RankingResults stored = resultsRepository.findById(sessionId).orElseGet(() -> {
            RankingResults created = new RankingResults();
            created.setSessionId(sessionId);
            return created;
        });
        stored.setContent(serialize(content));
        stored.setComputedAt(clock.instant());
        resultsRepository.save(stored);

        if (!session.getState().isTerminal()) {
            session.setState(SessionState.RESULTS);
            sessionRepository.save(session);
        }

        log.info("Computed ranking results for session {}: {} items, {} raters",
                sessionId, results.size(), participantsWhoRated);
        return new ComputeRankingResultsResponse(true, results.size(), participantsWhoRated);
    }

    @Override
    @Transactional(readOnly = true)
    public RankingResultsContent getRankingResults(String sessionId) {
        sessionAccessService.requireSession(sessionId);
        RankingResults stored = resultsRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("No ranking results computed yet for session " + sessionId));
        try {
            return objectMapper.readValue(stored.getContent(), RankingResultsContent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored ranking results for session " + sessionId + " are unreadable", e);
        }
    }

    private String serialize(RankingResultsContent content) {
        try {
            return objectMapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize ranking results", e);
        }
    }

    private record ScoredItem(RankingItem item, List<MetricScore> scores, double overallScore) {
    }
}
