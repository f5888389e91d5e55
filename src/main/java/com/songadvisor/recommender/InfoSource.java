package com.songadvisor.recommender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the reference track the user asked recommendations for.
 * <p>
 * The last lookup is cached, so loading the same (artist, track) twice in a row costs one
 * provider call. Each load records a permanent "Initial song" hypothesis and makes it the
 * blackboard's reference. The seed candidate never enters the pool.
 *
 * @author Song Advisor Team
 * @since 1.0
 */
public class InfoSource implements KnowledgeSource {
    private static final Logger logger = LoggerFactory.getLogger(InfoSource.class);

    private final Blackboard blackboard;
    private final MusicDataProviderInterface provider;
    private String thinkingAbout;
    private TrackInfo lastLookup;

    public InfoSource(Blackboard blackboard, MusicDataProviderInterface provider) {
        this.blackboard = blackboard;
        this.provider = provider;
    }

    /**
     * Fetches the named track and installs it as the reference.
     * @param artist artist name
     * @param track track name
     * @return the seed candidate
     * @throws ProviderException if the track cannot be looked up
     */
    public Candidate load(String artist, String track) {
        String song = artist + " - " + track;
        if (!song.equals(thinkingAbout) || lastLookup == null) {
            lastLookup = provider.getTrackInfo(artist, track);
            thinkingAbout = song;
        } else {
            logger.debug("Reusing cached track info for {}", song);
        }
        Candidate seed = new Candidate(lastLookup, this);
        seed.subscribe(this);
        Hypothesis initial = Hypothesis.permanent(seed, this, HypothesisReason.INITIAL_SONG);
        blackboard.record(initial);
        blackboard.setSolving(initial);
        logger.info("Reference track: {} (playcount {})", seed.id(), seed.playcount());
        return seed;
    }

    @Override
    public void onFeedback(Candidate candidate, Feedback feedback) {
        // the seed is never a competing proposal
    }
}
