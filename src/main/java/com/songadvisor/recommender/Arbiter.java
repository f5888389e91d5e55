package com.songadvisor.recommender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Resolves the picks of the two scoring sources into one recommendation and applies the user's
 * verdict to the blackboard.
 * <p>
 * The playcount source is asked first and wins ties.
 *
 * @author Song Advisor Team
 * @since 1.0
 */
public class Arbiter {
    private static final Logger logger = LoggerFactory.getLogger(Arbiter.class);

    private final Blackboard blackboard;
    private final PlaycountSource playcountSource;
    private final TagSource tagSource;
    private final SimilarTrackSource similarTrackSource;
    private final int refillCount;

    public Arbiter(Blackboard blackboard, PlaycountSource playcountSource, TagSource tagSource,
                   SimilarTrackSource similarTrackSource, int refillCount) {
        this.blackboard = blackboard;
        this.playcountSource = playcountSource;
        this.tagSource = tagSource;
        this.similarTrackSource = similarTrackSource;
        this.refillCount = refillCount;
    }

    /**
     * @return the best candidate, or empty when the pool is exhausted or no source has a pick
     */
    public Optional<Candidate> recommend() {
        if (blackboard.pool().isEmpty()) {
            return Optional.empty();
        }
        Optional<ScoredPick> playcountSuggestion = playcountSource.choose();
        Optional<ScoredPick> tagMatchSuggestion = tagSource.choose();
        if (playcountSuggestion.isPresent() && tagMatchSuggestion.isPresent()) {
            ScoredPick byPlaycount = playcountSuggestion.get();
            ScoredPick byTags = tagMatchSuggestion.get();
            logger.debug("Playcount pick {} ({}), tag pick {} ({})",
                byPlaycount.candidate().id(), byPlaycount.score(), byTags.candidate().id(), byTags.score());
            return Optional.of(byPlaycount.score() >= byTags.score() ? byPlaycount.candidate() : byTags.candidate());
        }
        return playcountSuggestion.or(() -> tagMatchSuggestion).map(ScoredPick::candidate);
    }

    /**
     * The user liked {@code recommendation}: it becomes the new reference and the pool is rebuilt
     * around its artist.
     */
    public void accept(Candidate recommendation) {
        recommendation.notify(Feedback.ACCEPTED);
        blackboard.clearPool();
        Hypothesis liked = Hypothesis.permanent(recommendation, recommendation.origin(), HypothesisReason.LIKED);
        blackboard.record(liked);
        blackboard.setSolving(liked);
        logger.info("New reference track: {}", recommendation.id());
        similarTrackSource.gather(recommendation.artist(), recommendation.name(), refillCount);
    }

    /**
     * The user disliked {@code recommendation}: it is recorded as such, its subscribers react, and
     * it leaves the pool.
     * @throws ProviderException if a subscriber's lookup fails; the candidate is evicted regardless
     */
    public void reject(Candidate recommendation) {
        blackboard.record(Hypothesis.permanent(recommendation, recommendation.origin(), HypothesisReason.DISLIKED));
        try {
            recommendation.notify(Feedback.REJECTED);
        } finally {
            // leaves the pool even when a subscriber's refill lookup fails
            blackboard.evict(recommendation);
        }
    }
}
