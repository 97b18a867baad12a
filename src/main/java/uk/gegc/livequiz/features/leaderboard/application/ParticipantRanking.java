package uk.gegc.livequiz.features.leaderboard.application;

import uk.gegc.livequiz.features.session.domain.model.Participant;

import java.util.Comparator;

/**
 * Leaderboard order: score descending, then earliest join, then participant id.
 */
public final class ParticipantRanking {

    public static final Comparator<Participant> ORDER = Comparator
            .comparingInt(Participant::getScore).reversed()
            .thenComparing(Participant::getJoinedAt)
            .thenComparing(Participant::getId);

    private ParticipantRanking() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
