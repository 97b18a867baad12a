package uk.gegc.livequiz.features.analytics.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.livequiz.features.analytics.domain.model.SessionAnalyticsReport;
import uk.gegc.livequiz.features.analytics.domain.model.SessionAnalyticsReport.*;
import uk.gegc.livequiz.features.answer.domain.model.AnswerRecord;
import uk.gegc.livequiz.features.leaderboard.application.ParticipantRanking;
import uk.gegc.livequiz.features.leaderboard.application.StreakCalculator;
import uk.gegc.livequiz.features.question.application.scoring.FreeTextNormalizer;
import uk.gegc.livequiz.features.question.domain.model.AnswerKeyEntry;
import uk.gegc.livequiz.features.question.domain.model.QuestionType;
import uk.gegc.livequiz.features.session.domain.model.LiveSession;
import uk.gegc.livequiz.features.session.domain.model.Participant;
import uk.gegc.livequiz.shared.config.ScoringProperties;

import java.util.*;

/**
 * Builds a {@link SessionAnalyticsReport} from the immutable answer records of a finished session.
 * Pure aggregation: reads nothing from the database and writes nothing.
 */
@Component
@RequiredArgsConstructor
public class SessionAnalyticsCalculator {

    static final int MAX_TEXT_GROUPS = 20;
    static final int TARGET_SCORE_BINS = 10;

    private final FreeTextNormalizer normalizer;
    private final StreakCalculator streakCalculator;
    private final ScoringProperties scoringProperties;

    /**
     * @param keys         answer key entries of the questions played, in question order
     * @param participants every participant with their answers loaded
     */
    public SessionAnalyticsReport compute(LiveSession session, List<AnswerKeyEntry> keys, List<Participant> participants) {
        List<Participant> ranked = new ArrayList<>(participants);
        ranked.sort(ParticipantRanking.ORDER);

        Map<String, Map<Integer, AnswerRecord>> records = new HashMap<>();
        for (Participant participant : ranked) {
            Map<Integer, AnswerRecord> byIndex = new HashMap<>();
            for (AnswerRecord record : participant.getAnswers()) {
                byIndex.put(record.getQuestionIndex(), record);
            }
            records.put(participant.getId(), byIndex);
        }

        List<QuestionStats> questionStats = new ArrayList<>();
        for (AnswerKeyEntry key : keys) {
            List<AnswerRecord> answers = new ArrayList<>();
            for (Participant participant : ranked) {
                AnswerRecord record = records.get(participant.getId()).get(key.getQuestionIndex());
                if (record != null && !record.isTimedOut()) {
                    answers.add(record);
                }
            }
            questionStats.add(buildQuestionStats(key, answers, ranked.size()));
        }

        List<PlayerStats> leaderboard = buildLeaderboard(ranked, keys, records);
        List<PositionHistoryEntry> positionHistory = buildPositionHistory(ranked, keys, records);
        List<ScoreBin> scoreDistribution = buildScoreDistribution(ranked.stream().mapToInt(Participant::getScore).toArray());
        AnalyticsSummary summary = buildSummary(questionStats, leaderboard, keys.size());

        return new SessionAnalyticsReport(
                session.getId(),
                session.getTitle(),
                keys.size(),
                ranked.size(),
                questionStats,
                positionHistory,
                scoreDistribution,
                leaderboard,
                summary
        );
    }

    QuestionStats buildQuestionStats(AnswerKeyEntry key, List<AnswerRecord> answers, int totalPlayers) {
        QuestionType type = key.getQuestionType();
        int answered = answers.size();
        int notAnswered = Math.max(0, totalPlayers - answered);

        int correctCount = type.isScored()
                ? (int) answers.stream().filter(AnswerRecord::isCorrect).count()
                : 0;
        int totalPoints = answers.stream().mapToInt(AnswerRecord::getPoints).sum();

        List<OptionStat> optionStats = type.hasOptions() ? buildOptionStats(key, answers) : null;
        SliderStats sliderStats = type == QuestionType.SLIDER ? buildSliderStats(key, answers) : null;
        List<TextGroup> textGroups = type == QuestionType.FREE_RESPONSE || type == QuestionType.POLL_FREE_TEXT
                ? buildTextGroups(key, answers)
                : null;

        return new QuestionStats(
                key.getQuestionIndex(),
                type,
                key.getQuestionText(),
                answered,
                notAnswered,
                percentage(notAnswered, totalPlayers),
                percentage(answered, totalPlayers),
                correctCount,
                type.isScored() ? percentage(correctCount, answered) : 0.0,
                answered > 0 ? (double) totalPoints / answered : 0.0,
                optionStats,
                sliderStats,
                textGroups
        );
    }

    private List<OptionStat> buildOptionStats(AnswerKeyEntry key, List<AnswerRecord> answers) {
        Map<Integer, Integer> counts = new HashMap<>();
        int highestIndex = key.optionCount() - 1;
        for (AnswerRecord answer : answers) {
            List<Integer> chosen = answer.getAnswerIndex() != null
                    ? List.of(answer.getAnswerIndex())
                    : Optional.ofNullable(answer.getAnswerIndices()).orElse(List.of());
            for (Integer index : chosen) {
                counts.merge(index, 1, Integer::sum);
                highestIndex = Math.max(highestIndex, index);
            }
        }

        Set<Integer> correct = correctOptions(key);
        List<OptionStat> stats = new ArrayList<>();
        for (int i = 0; i <= highestIndex; i++) {
            String label = i < key.optionCount() ? key.getOptionLabels().get(i) : "Option " + (i + 1);
            int count = counts.getOrDefault(i, 0);
            stats.add(new OptionStat(label, count, percentage(count, answers.size()), correct.contains(i)));
        }
        return stats;
    }

    private Set<Integer> correctOptions(AnswerKeyEntry key) {
        if (key.getQuestionType() == QuestionType.SINGLE_CHOICE && key.getCorrectIndex() != null) {
            return Set.of(key.getCorrectIndex());
        }
        if (key.getQuestionType() == QuestionType.MULTIPLE_CHOICE && key.getCorrectIndices() != null) {
            return new HashSet<>(key.getCorrectIndices());
        }
        return Set.of();
    }

    private SliderStats buildSliderStats(AnswerKeyEntry key, List<AnswerRecord> answers) {
        List<Double> values = answers.stream()
                .map(AnswerRecord::getSliderValue)
                .filter(Objects::nonNull)
                .toList();
        return new SliderStats(key.getCorrectValue(), key.getMinValue(), key.getMaxValue(), values);
    }

    private List<TextGroup> buildTextGroups(AnswerKeyEntry key, List<AnswerRecord> answers) {
        // Insertion order keeps the first spelling seen for each normalized group
        Map<String, int[]> counts = new LinkedHashMap<>();
        Map<String, Boolean> correctness = new HashMap<>();
        for (AnswerRecord answer : answers) {
            String normalized = normalizer.normalize(answer.getTextAnswer(), key.isCaseSensitive());
            if (normalized.isEmpty()) {
                continue;
            }
            counts.computeIfAbsent(normalized, k -> new int[1])[0]++;
            correctness.putIfAbsent(normalized, answer.isCorrect());
        }

        return counts.entrySet().stream()
                .map(entry -> new TextGroup(entry.getKey(), entry.getValue()[0], correctness.get(entry.getKey())))
                .sorted(Comparator.comparingInt(TextGroup::count).reversed().thenComparing(TextGroup::text))
                .limit(MAX_TEXT_GROUPS)
                .toList();
    }

    private List<PlayerStats> buildLeaderboard(List<Participant> ranked, List<AnswerKeyEntry> keys,
                                               Map<String, Map<Integer, AnswerRecord>> records) {
        long scoredQuestions = keys.stream().filter(key -> key.getQuestionType().isScored()).count();

        List<PlayerStats> leaderboard = new ArrayList<>();
        for (int i = 0; i < ranked.size(); i++) {
            Participant participant = ranked.get(i);
            Map<Integer, AnswerRecord> byIndex = records.get(participant.getId());

            int correct = 0;
            int answered = 0;
            for (AnswerKeyEntry key : keys) {
                AnswerRecord record = byIndex.get(key.getQuestionIndex());
                if (record == null || record.isTimedOut()) {
                    continue;
                }
                answered++;
                if (key.getQuestionType().isScored() && record.isCorrect()) {
                    correct++;
                }
            }

            leaderboard.add(new PlayerStats(
                    participant.getId(),
                    participant.getDisplayName(),
                    i + 1,
                    participant.getScore(),
                    correct,
                    answered,
                    keys.size() - answered,
                    scoredQuestions > 0 ? (double) correct / scoredQuestions * 100.0 : 0.0,
                    streakCalculator.longestStreak(keys, byIndex)
            ));
        }
        return leaderboard;
    }

    private List<PositionHistoryEntry> buildPositionHistory(List<Participant> ranked, List<AnswerKeyEntry> keys,
                                                            Map<String, Map<Integer, AnswerRecord>> records) {
        int trackedRanks = scoringProperties.getLeaderboardSize();
        Map<String, List<Integer>> positions = new HashMap<>();
        Map<String, Integer> cumulative = new HashMap<>();
        Set<String> everTracked = new HashSet<>();
        ranked.forEach(participant -> {
            positions.put(participant.getId(), new ArrayList<>());
            cumulative.put(participant.getId(), 0);
        });

        for (AnswerKeyEntry key : keys) {
            for (Participant participant : ranked) {
                AnswerRecord record = records.get(participant.getId()).get(key.getQuestionIndex());
                if (record != null) {
                    cumulative.merge(participant.getId(), record.getPoints(), Integer::sum);
                }
            }

            List<Participant> order = new ArrayList<>(ranked);
            order.sort(Comparator.<Participant>comparingInt(participant -> cumulative.get(participant.getId())).reversed()
                    .thenComparing(Participant::getJoinedAt)
                    .thenComparing(Participant::getId));
            for (int i = 0; i < order.size(); i++) {
                String id = order.get(i).getId();
                positions.get(id).add(i + 1);
                if (i < trackedRanks) {
                    everTracked.add(id);
                }
            }
        }

        return ranked.stream()
                .filter(participant -> everTracked.contains(participant.getId()))
                .map(participant -> new PositionHistoryEntry(
                        participant.getId(),
                        participant.getDisplayName(),
                        List.copyOf(positions.get(participant.getId())),
                        participant.getScore()))
                .toList();
    }

    List<ScoreBin> buildScoreDistribution(int[] scores) {
        if (scores.length == 0) {
            return List.of();
        }
        int maxScore = Arrays.stream(scores).max().orElse(0);
        int minScore = Math.min(0, Arrays.stream(scores).min().orElse(0));
        int range = maxScore - minScore;
        if (range == 0) {
            return List.of(new ScoreBin(minScore, maxScore, scores.length));
        }

        int binSize = (int) Math.ceil((double) range / TARGET_SCORE_BINS);
        if (binSize > 100) {
            binSize = (int) Math.ceil(binSize / 100.0) * 100;
        } else if (binSize > 10) {
            binSize = (int) Math.ceil(binSize / 10.0) * 10;
        }

        List<ScoreBin> bins = new ArrayList<>();
        int start = Math.floorDiv(minScore, binSize) * binSize;
        for (int binStart = start; binStart <= maxScore; binStart += binSize) {
            int binEnd = binStart + binSize;
            int lower = binStart;
            int count = (int) Arrays.stream(scores).filter(score -> score >= lower && score < binEnd).count();
            // Empty bins are skipped, except the last one which closes the range
            if (count > 0 || binEnd > maxScore) {
                bins.add(new ScoreBin(binStart, binEnd - 1, count));
            }
        }
        return bins;
    }

    private AnalyticsSummary buildSummary(List<QuestionStats> questionStats, List<PlayerStats> leaderboard, int totalQuestions) {
        List<QuestionStats> scored = questionStats.stream()
                .filter(stats -> stats.questionType().isScored() && stats.totalAnswered() > 0)
                .sorted(Comparator.comparingDouble(QuestionStats::correctRate)
                        .thenComparingInt(QuestionStats::questionIndex))
                .toList();

        QuestionRate hardest = null;
        QuestionRate easiest = null;
        if (!scored.isEmpty()) {
            QuestionStats first = scored.get(0);
            QuestionStats last = scored.get(scored.size() - 1);
            hardest = new QuestionRate(first.questionIndex(), first.correctRate());
            easiest = new QuestionRate(last.questionIndex(), last.correctRate());
        }

        return new AnalyticsSummary(
                leaderboard.size(),
                totalQuestions,
                hardest,
                easiest,
                leaderboard.stream().mapToInt(PlayerStats::finalScore).average().orElse(0.0),
                leaderboard.stream().mapToDouble(PlayerStats::accuracy).average().orElse(0.0),
                questionStats.stream().mapToDouble(QuestionStats::timeoutRate).average().orElse(0.0)
        );
    }

    private static double percentage(int part, int whole) {
        return whole > 0 ? (double) part / whole * 100.0 : 0.0;
    }
}
