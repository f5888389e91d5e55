package com.songadvisor.recommender;

/**
 * Ways the playcount matcher can relate a candidate's playcount to the reference's.
 */
public enum PlaycountStrategy {
    CLOSEST("closest playcount"),
    MORE("more plays"),
    A_LOT_MORE("a lot more plays"),
    FEWER("fewer plays"),
    A_LOT_FEWER("a lot fewer plays");

    private final String label;

    PlaycountStrategy(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Strategy to try when this one has no candidate; CLOSEST has no pair and maps to itself.
     */
    public PlaycountStrategy paired() {
        switch (this) {
            case MORE: return A_LOT_MORE;
            case A_LOT_MORE: return MORE;
            case FEWER: return A_LOT_FEWER;
            case A_LOT_FEWER: return FEWER;
            default: return CLOSEST;
        }
    }

    @Override
    public String toString() {
        return label;
    }
}
