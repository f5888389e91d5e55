package com.songadvisor.recommender;

/**
 * Reasons attached to permanent hypotheses. Scoring sources use free-text reasons of their own.
 */
public final class HypothesisReason {
    private HypothesisReason() {}

    public static final String INITIAL_SONG = "Initial song";
    public static final String LIKED = "Liked by user";
    public static final String DISLIKED = "Disliked by user";
}
