package uk.gegc.livequiz.features.ranking.application.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import uk.gegc.livequiz.features.ranking.api.dto.ComputeRankingResultsResponse;
import uk.gegc.livequiz.features.ranking.domain.model.*;
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
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("RankingResultsService Tests")
class RankingResultsServiceImplTest {

    private static final String SESSION_ID = "session-1";
    private static final String HOST = "host";
    private static final Instant NOW = Instant.parse("2024-01-01T12:45:00Z");

    @Mock
    private SessionAccessService sessionAccessService;
    @Mock
    private LiveSessionRepository sessionRepository;
    @Mock
    private ParticipantRepository participantRepository;
    @Mock
    private RankingMetricRepository metricRepository;
    @Mock
    private RankingItemRepository itemRepository;
    @Mock
    private ItemRatingRepository ratingRepository;
    @Mock
    private RankingResultsRepository resultsRepository;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RankingResultsServiceImpl service;
    private LiveSession session;
    private List<ItemRating> ratings;

    @BeforeEach
    void setUp() {
        service = new RankingResultsServiceImpl(
                sessionAccessService,
                sessionRepository,
                participantRepository,
                metricRepository,
                itemRepository,
                ratingRepository,
                resultsRepository,
                objectMapper,
                Clock.fixed(NOW, ZoneOffset.UTC)
        );

        session = new LiveSession();
        session.setId(SESSION_ID);
        session.setHostId(HOST);
        session.setActivityType(ActivityType.RANKING);
        session.setState(SessionState.QUESTION);

        List<RankingMetric> metrics = List.of(
                metric(1L, "impact", 0, 2.0, false),
                metric(2L, "effort", 1, 1.0, true)
        );
        List<RankingItem> items = List.of(
                item(11L, "idea-a", 0),
                item(12L, "idea-b", 1),
                item(13L, "idea-c", 2)
        );

        ratings = new ArrayList<>();
        // idea-a: impact 3,3 effort 3,3 -> 0.5 overall
        rate("p-1", 11L, 1L, 3);
        rate("p-2", 11L, 1L, 3);
        rate("p-1", 11L, 2L, 3);
        rate("p-2", 11L, 2L, 3);
        // idea-b: impact 5,5 effort 1,1 -> 1.0 overall
        rate("p-1", 12L, 1L, 5);
        rate("p-2", 12L, 1L, 5);
        rate("p-1", 12L, 2L, 1);
        rate("p-2", 12L, 2L, 1);
        // idea-c: impact 1,5 only -> 0.5 overall, polarized
        rate("p-1", 13L, 1L, 1);
        rate("p-2", 13L, 1L, 5);

        when(sessionAccessService.requireHostedSession(SESSION_ID, HOST)).thenReturn(session);
        when(sessionAccessService.requireSession(SESSION_ID)).thenReturn(session);
        when(metricRepository.findBySessionIdOrderByDisplayOrderAscIdAsc(SESSION_ID)).thenReturn(metrics);
        when(itemRepository.findBySessionIdAndApprovedTrueOrderByDisplayOrderAscIdAsc(SESSION_ID)).thenReturn(items);
        when(ratingRepository.findBySessionId(SESSION_ID)).thenReturn(ratings);
        when(ratingRepository.countRaters(SESSION_ID)).thenReturn(2L);
        when(participantRepository.countBySessionId(SESSION_ID)).thenReturn(3L);
        when(resultsRepository.findById(SESSION_ID)).thenReturn(Optional.empty());
        when(resultsRepository.save(any(RankingResults.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private static RankingMetric metric(Long id, String key, int order, double weight, boolean lowerIsBetter) {
        RankingMetric metric = new RankingMetric();
        metric.setId(id);
        metric.setSessionId(SESSION_ID);
        metric.setMetricKey(key);
        metric.setName(key);
        metric.setScaleMin(1);
        metric.setScaleMax(5);
        metric.setWeight(weight);
        metric.setLowerIsBetter(lowerIsBetter);
        metric.setDisplayOrder(order);
        return metric;
    }

    private static RankingItem item(Long id, String key, int order) {
        RankingItem item = new RankingItem();
        item.setId(id);
        item.setSessionId(SESSION_ID);
        item.setItemKey(key);
        item.setText("Text " + key);
        item.setDisplayOrder(order);
        return item;
    }

    private void rate(String participantId, Long itemId, Long metricId, int value) {
        ItemRating rating = new ItemRating();
        rating.setSessionId(SESSION_ID);
        rating.setParticipantId(participantId);
        rating.setItemId(itemId);
        rating.setMetricId(metricId);
        rating.setValue(value);
        ratings.add(rating);
    }

    private RankingResultsContent storedContent() throws Exception {
        ArgumentCaptor<RankingResults> captor = ArgumentCaptor.forClass(RankingResults.class);
        verify(resultsRepository).save(captor.capture());
        return objectMapper.readValue(captor.getValue().getContent(), RankingResultsContent.class);
    }

    @Nested
    @DisplayName("computeRankingResults")
    class Compute {

        @Test
        @DisplayName("computeRankingResults: orders items by overall score then display order")
        void computeRankingResults_ordersItems() throws Exception {
            // When
            ComputeRankingResultsResponse response = service.computeRankingResults(SESSION_ID, HOST);

            // Then
            assertThat(response.success()).isTrue();
            assertThat(response.totalItems()).isEqualTo(3);
            assertThat(response.participantsWhoRated()).isEqualTo(2);

            RankingResultsContent content = storedContent();
            assertThat(content.items()).extracting(RankingItemResult::itemId)
                    .containsExactly("idea-b", "idea-a", "idea-c");
            assertThat(content.items()).extracting(RankingItemResult::rank).containsExactly(1, 2, 3);
            assertThat(content.totalParticipants()).isEqualTo(3);
            assertThat(content.participantsWhoRated()).isEqualTo(2);
        }

        @Test
        @DisplayName("computeRankingResults: per-metric scores keep metric order and invert lower-is-better metrics")
        void computeRankingResults_metricScores() throws Exception {
            // When
            service.computeRankingResults(SESSION_ID, HOST);

            // Then
            RankingItemResult top = storedContent().items().get(0);
            assertThat(top.overallScore()).isCloseTo(1.0, within(1e-9));
            assertThat(top.metricScores()).containsOnlyKeys("impact", "effort");
            assertThat(top.metricScores().keySet()).containsExactly("impact", "effort");
            assertThat(top.metricScores().get("effort").rawAverage()).isEqualTo(1.0);
            assertThat(top.metricScores().get("effort").normalizedAverage()).isEqualTo(1.0);
            assertThat(top.consensusLevel()).isEqualTo(ConsensusLevel.HIGH);
        }

        @Test
        @DisplayName("computeRankingResults: unrated metric is neutral and ignored for the overall score")
        void computeRankingResults_unratedMetric() throws Exception {
            // When
            service.computeRankingResults(SESSION_ID, HOST);

            // Then
            RankingItemResult polarized = storedContent().items().get(2);
            assertThat(polarized.overallScore()).isCloseTo(0.5, within(1e-9));
            assertThat(polarized.metricScores().get("effort").responseCount()).isZero();
            assertThat(polarized.metricScores().get("effort").normalizedAverage()).isEqualTo(0.5);
            assertThat(polarized.consensusLevel()).isEqualTo(ConsensusLevel.LOW);
        }

        @Test
        @DisplayName("computeRankingResults: moves the session to results")
        void computeRankingResults_movesToResults() {
            // When
            service.computeRankingResults(SESSION_ID, HOST);

            // Then
            assertThat(session.getState()).isEqualTo(SessionState.RESULTS);
            verify(sessionRepository).save(session);
        }

        @Test
        @DisplayName("computeRankingResults: an ended session keeps its state")
        void computeRankingResults_endedSession_keepsState() {
            // Given
            session.setState(SessionState.ENDED);

            // When
            service.computeRankingResults(SESSION_ID, HOST);

            // Then
            assertThat(session.getState()).isEqualTo(SessionState.ENDED);
            verify(sessionRepository, never()).save(any());
        }

        @Test
        @DisplayName("computeRankingResults: repeated computation gives the same document")
        void computeRankingResults_isIdempotent() {
            // When
            service.computeRankingResults(SESSION_ID, HOST);
            service.computeRankingResults(SESSION_ID, HOST);

            // Then
            ArgumentCaptor<RankingResults> captor = ArgumentCaptor.forClass(RankingResults.class);
            verify(resultsRepository, times(2)).save(captor.capture());
            assertThat(captor.getAllValues().get(1).getContent()).isEqualTo(captor.getAllValues().get(0).getContent());
        }

        @Test
        @DisplayName("computeRankingResults: rejects non-ranking sessions")
        void computeRankingResults_quizSession_throws() {
            // Given
            session.setActivityType(ActivityType.QUIZ);

            // When & Then
            assertThatThrownBy(() -> service.computeRankingResults(SESSION_ID, HOST))
                    .isInstanceOf(PreconditionFailedException.class);
            verify(resultsRepository, never()).save(any());
        }

        @Test
        @DisplayName("computeRankingResults: rejects a session without approved items")
        void computeRankingResults_noItems_throws() {
            // Given
            when(itemRepository.findBySessionIdAndApprovedTrueOrderByDisplayOrderAscIdAsc(SESSION_ID)).thenReturn(List.of());

            // When & Then
            assertThatThrownBy(() -> service.computeRankingResults(SESSION_ID, HOST))
                    .isInstanceOf(PreconditionFailedException.class)
                    .hasMessageContaining("no approved items");
        }
    }

    @Nested
    @DisplayName("getRankingResults")
    class Get {

        @Test
        @DisplayName("getRankingResults: reads the stored document")
        void getRankingResults_returnsStored() {
            // Given
            service.computeRankingResults(SESSION_ID, HOST);
            ArgumentCaptor<RankingResults> captor = ArgumentCaptor.forClass(RankingResults.class);
            verify(resultsRepository).save(captor.capture());
            when(resultsRepository.findById(SESSION_ID)).thenReturn(Optional.of(captor.getValue()));

            // When
            RankingResultsContent content = service.getRankingResults(SESSION_ID);

            // Then
            assertThat(content.items()).hasSize(3);
            assertThat(content.items().get(0).itemText()).isEqualTo("Text idea-b");
        }

        @Test
        @DisplayName("getRankingResults: not found before computation")
        void getRankingResults_notComputed_throws() {
            assertThatThrownBy(() -> service.getRankingResults(SESSION_ID))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }
}
