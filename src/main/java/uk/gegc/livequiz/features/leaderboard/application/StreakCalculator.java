package uk.gegc.livequiz.features.leaderboard.application;

import org.springframework.stereotype.Component;
import uk.gegc.livequiz.features.answer.domain.model.AnswerRecord;
import uk.gegc.livequiz.features.question.domain.model.AnswerKeyEntry;

import java.util.List;
import java.util.Map;

/**
 * Derives a participant's streak by replaying the answer history question by question.
 * <p>
 * Missing or timed-out answers reset the streak, poll questions leave it unchanged,
 * correct answers extend it and anything else resets it. The stored streak is never read,
 * so repeated computation over the same records gives the same value.
 * </p>
 */
@Component
public class StreakCalculator {

    /**
     * @param keys            answer key entries in ascending question order, up to the question being closed
     * @param recordsByIndex  the participant's answer records keyed by question index
     */
    public int streakAfter(List<AnswerKeyEntry> keys, Map<Integer, AnswerRecord> recordsByIndex) {
        int streak = 0;
        for (AnswerKeyEntry key : keys) {
            streak = next(streak, key, recordsByIndex.get(key.getQuestionIndex()));
        }
        return streak;
    }

    /**
     * Longest run reached at any point over the given questions.
     */
    public int longestStreak(List<AnswerKeyEntry> keys, Map<Integer, AnswerRecord> recordsByIndex) {
        int streak = 0;
        int longest = 0;
        for (AnswerKeyEntry key : keys) {
            streak = next(streak, key, recordsByIndex.get(key.getQuestionIndex()));
            longest = Math.max(longest, streak);
        }
        return longest;
    }

    public int next(int streak, AnswerKeyEntry key, AnswerRecord record) {
        if (record == null || record.isTimedOut()) {
            return 0;
        }
        if (key.getQuestionType().isPoll()) {
            return streak;
        }
        return record.isCorrect() ? streak + 1 : 0;
    }
}
