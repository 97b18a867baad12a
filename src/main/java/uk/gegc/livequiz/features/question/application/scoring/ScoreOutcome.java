package uk.gegc.livequiz.features.question.application.scoring;

/**
 * Points and correctness flags awarded for one submission.
 */
public record ScoreOutcome(int points, boolean correct, boolean partiallyCorrect, boolean timedOut) {

    public static final int MAX_POINTS = 1000;

    public ScoreOutcome {
        if (points < 0 || points > MAX_POINTS) {
            throw new IllegalArgumentException("points out of range: " + points);
        }
    }

    public static ScoreOutcome correct(int points) {
        return new ScoreOutcome(points, true, false, false);
    }

    public static ScoreOutcome partial(int points) {
        return new ScoreOutcome(points, false, true, false);
    }

    public static ScoreOutcome incorrect() {
        return new ScoreOutcome(0, false, false, false);
    }

    public static ScoreOutcome timeout() {
        return new ScoreOutcome(0, false, false, true);
    }
}
