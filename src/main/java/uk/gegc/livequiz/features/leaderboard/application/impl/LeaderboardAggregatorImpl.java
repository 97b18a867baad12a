package uk.gegc.livequiz.features.leaderboard.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.livequiz.features.answer.domain.model.AnswerRecord;
import uk.gegc.livequiz.features.leaderboard.api.dto.LeaderboardSnapshotDto;
import uk.gegc.livequiz.features.leaderboard.api.dto.QuestionResultsResponse;
import uk.gegc.livequiz.features.leaderboard.application.LeaderboardAggregator;
import uk.gegc.livequiz.features.leaderboard.application.ParticipantRanking;
import uk.gegc.livequiz.features.leaderboard.application.StreakCalculator;
import uk.gegc.livequiz.features.leaderboard.domain.model.LeaderboardContent;
import uk.gegc.livequiz.features.leaderboard.domain.model.LeaderboardContent.LeaderboardEntry;
import uk.gegc.livequiz.features.leaderboard.domain.model.LeaderboardContent.PlayerRank;
import uk.gegc.livequiz.features.leaderboard.domain.model.LeaderboardSnapshot;
import uk.gegc.livequiz.features.leaderboard.domain.repository.LeaderboardSnapshotRepository;
import uk.gegc.livequiz.features.question.domain.model.AnswerKeyEntry;
import uk.gegc.livequiz.features.question.domain.repository.AnswerKeyEntryRepository;
import uk.gegc.livequiz.features.session.application.SessionAccessService;
import uk.gegc.livequiz.features.session.domain.model.LiveSession;
import uk.gegc.livequiz.features.session.domain.model.Participant;
import uk.gegc.livequiz.features.session.domain.model.SessionState;
import uk.gegc.livequiz.features.session.domain.repository.ParticipantRepository;
import uk.gegc.livequiz.shared.config.ScoringProperties;
import uk.gegc.livequiz.shared.exception.PreconditionFailedException;
import uk.gegc.livequiz.shared.exception.ResourceNotFoundException;
import uk.gegc.livequiz.shared.exception.ValidationException;

import java.time.Clock;
import java.util.*;

/**
 * Implementation of {@link LeaderboardAggregator}.
 * <p>
 * Reads every participant with their answers once, then in a single pass collects scores,
 * tallies the answer distribution of the closed question and replays streaks. The snapshot
 * and the streak write-back commit in the same transaction.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeaderboardAggregatorImpl implements LeaderboardAggregator {

    private final ParticipantRepository participantRepository;
    private final AnswerKeyEntryRepository answerKeyRepository;
    private final LeaderboardSnapshotRepository snapshotRepository;
    private final SessionAccessService sessionAccessService;
    private final StreakCalculator streakCalculator;
    private final ScoringProperties scoringProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional
    public QuestionResultsResponse computeQuestionResults(String sessionId, int questionIndex, String username) {
        LiveSession session = sessionAccessService.requireHostedSession(sessionId, username);
        requireLatestClosedQuestion(session, questionIndex);

        List<AnswerKeyEntry> keys = answerKeyRepository
                .findBySessionIdAndQuestionIndexLessThanEqualOrderByQuestionIndexAsc(sessionId, questionIndex);
        AnswerKeyEntry key = keys.stream()
                .filter(entry -> entry.getQuestionIndex() == questionIndex)
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Question " + questionIndex + " not found"));

        List<Participant> participants = new ArrayList<>(participantRepository.findAllWithAnswersBySessionId(sessionId));
        int totalPlayers = participants.size();

        int[] counts = new int[key.optionCount()];
        int totalAnswered = 0;
        Map<String, Integer> streaks = new HashMap<>();
        Map<String, Integer> lastPoints = new HashMap<>();

        for (Participant participant : participants) {
            Map<Integer, AnswerRecord> recordsByIndex = new HashMap<>();
            for (AnswerRecord record : participant.getAnswers()) {
                recordsByIndex.put(record.getQuestionIndex(), record);
            }

            AnswerRecord answer = recordsByIndex.get(questionIndex);
            if (answer != null && !answer.isTimedOut()) {
                totalAnswered++;
                counts = tally(counts, answer);
            }
            lastPoints.put(participant.getId(), answer != null ? answer.getPoints() : 0);
            streaks.put(participant.getId(), streakCalculator.streakAfter(keys, recordsByIndex));
        }

        participants.sort(ParticipantRanking.ORDER);

        int topSize = scoringProperties.getLeaderboardSize();
        List<LeaderboardEntry> topPlayers = new ArrayList<>();
        Map<String, PlayerRank> playerRanks = new LinkedHashMap<>();
        Map<String, Integer> playerStreaks = new LinkedHashMap<>();
        for (int i = 0; i < participants.size(); i++) {
            Participant participant = participants.get(i);
            int rank = i + 1;
            int streak = streaks.get(participant.getId());
            if (i < topSize) {
                topPlayers.add(new LeaderboardEntry(
                        participant.getId(),
                        participant.getDisplayName(),
                        rank,
                        participant.getScore(),
                        streak,
                        lastPoints.get(participant.getId())
                ));
            }
            playerRanks.put(participant.getId(), new PlayerRank(rank, totalPlayers));
            playerStreaks.put(participant.getId(), streak);
        }

        LeaderboardContent content = new LeaderboardContent(
                questionIndex,
                topPlayers,
                totalPlayers,
                totalAnswered,
                Arrays.stream(counts).boxed().toList(),
                playerRanks,
                playerStreaks
        );

        LeaderboardSnapshot snapshot = snapshotRepository.findById(sessionId).orElseGet(() -> {
            LeaderboardSnapshot created = new LeaderboardSnapshot();
            created.setSessionId(sessionId);
            return created;
        });
        snapshot.setQuestionIndex(questionIndex);
        snapshot.setContent(serialize(content));
        snapshot.setComputedAt(clock.instant());
        snapshotRepository.save(snapshot);

        // Managed entities: changed streaks are flushed at commit with a version bump
        int updated = 0;
        for (Participant participant : participants) {
            int streak = playerStreaks.get(participant.getId());
            if (participant.getCurrentStreak() != streak) {
                participant.setCurrentStreak(streak);
                updated++;
            }
        }

        log.info("Computed results for question {} of session {}: {} players, {} answered, {} streaks updated",
                questionIndex, sessionId, totalPlayers, totalAnswered, updated);
        return new QuestionResultsResponse(true, questionIndex, totalPlayers, totalAnswered);
    }

    @Override
    @Transactional(readOnly = true)
    public LeaderboardSnapshotDto getLeaderboard(String sessionId) {
        sessionAccessService.requireSession(sessionId);
        LeaderboardSnapshot snapshot = snapshotRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("No leaderboard computed yet for session " + sessionId));
        return new LeaderboardSnapshotDto(
                sessionId,
                snapshot.getQuestionIndex(),
                snapshot.getComputedAt(),
                deserialize(snapshot.getContent())
        );
    }

    /**
     * Only the most recently closed question may be aggregated.
     */
    private static void requireLatestClosedQuestion(LiveSession session, int questionIndex) {
        int current = session.getCurrentQuestionIndex();
        if (questionIndex < 0 || questionIndex > current) {
            throw new ValidationException("Question " + questionIndex + " has not been reached in session " + session.getId());
        }
        if (questionIndex == current && session.getState() == SessionState.QUESTION) {
            throw new PreconditionFailedException("Question " + questionIndex + " is still open");
        }
        boolean currentOpened = session.getQuestionStartTime() != null;
        if (questionIndex == current && !currentOpened) {
            throw new PreconditionFailedException("Question " + questionIndex + " has not been opened yet");
        }
        int latestClosed = currentOpened ? current : current - 1;
        if (questionIndex < latestClosed) {
            throw new PreconditionFailedException("Question " + questionIndex
                    + " was superseded; results are computed for question " + latestClosed);
        }
    }

    private static int[] tally(int[] counts, AnswerRecord answer) {
        List<Integer> indices;
        if (answer.getAnswerIndex() != null) {
            indices = List.of(answer.getAnswerIndex());
        } else if (answer.getAnswerIndices() != null) {
            indices = answer.getAnswerIndices();
        } else {
            // Slider and text answers only count towards totalAnswered
            return counts;
        }

        int[] result = counts;
        for (int index : indices) {
            if (index < 0) {
                continue;
            }
            if (index >= result.length) {
                result = Arrays.copyOf(result, index + 1);
            }
            result[index]++;
        }
        return result;
    }

    private String serialize(LeaderboardContent content) {
        try {
            return objectMapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize leaderboard content", e);
        }
    }

    private LeaderboardContent deserialize(String content) {
        try {
            return objectMapper.readValue(content, LeaderboardContent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored leaderboard content is unreadable", e);
        }
    }
}
