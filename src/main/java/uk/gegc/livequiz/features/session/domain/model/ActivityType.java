package uk.gegc.livequiz.features.session.domain.model;

public enum ActivityType {
    QUIZ,
    POLL,
    RANKING
}
