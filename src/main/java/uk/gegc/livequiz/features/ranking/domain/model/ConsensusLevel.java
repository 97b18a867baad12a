package uk.gegc.livequiz.features.ranking.domain.model;

/**
 * Agreement among raters, from the spread of ratings relative to the scale width.
 */
public enum ConsensusLevel {
    HIGH,
    MEDIUM,
    LOW;

    public static ConsensusLevel fromRelativeSpread(double relativeSpread) {
        if (relativeSpread < 0.15) {
            return HIGH;
        }
        if (relativeSpread < 0.30) {
            return MEDIUM;
        }
        return LOW;
    }
}
