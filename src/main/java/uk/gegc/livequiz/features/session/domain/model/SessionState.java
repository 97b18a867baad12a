package uk.gegc.livequiz.features.session.domain.model;

public enum SessionState {
    LOBBY,
    PREPARING,
    QUESTION,
    LEADERBOARD,
    RESULTS,
    ENDED,
    CANCELLED;

    public boolean isTerminal() {
        return this == ENDED || this == CANCELLED;
    }
}
