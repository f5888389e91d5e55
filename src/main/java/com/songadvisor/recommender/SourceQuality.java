package com.songadvisor.recommender;

/**
 * Self-assessed track record of a scoring source, applied as a multiplier to its scores.
 */
public enum SourceQuality {
    NEUTRAL(1.0),
    GOOD(1.25),
    POOR(0.75);

    private final double multiplier;

    SourceQuality(double multiplier) {
        this.multiplier = multiplier;
    }

    public double apply(double score) {
        return score * multiplier;
    }
}
