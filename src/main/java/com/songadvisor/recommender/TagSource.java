package com.songadvisor.recommender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Picks the pool candidate sharing the most top tags with the reference track.
 * <p>
 * Tags are fetched on first use and cached on the candidate, keeping at most
 * {@value #TAG_LIMIT}; the provider does not honour its limit parameter, so the list is cut here.
 * The score is the share of the reference's tags the winner matches, as a percentage. On ties the
 * first candidate in pool order wins.
 *
 * @author Song Advisor Team
 * @since 1.0
 */
public class TagSource implements ScoringSource {
    private static final Logger logger = LoggerFactory.getLogger(TagSource.class);

    static final int TAG_LIMIT = 19;
    static final String REASON = "Closest match on tags";

    private final Blackboard blackboard;
    private final MusicDataProviderInterface provider;

    public TagSource(Blackboard blackboard, MusicDataProviderInterface provider) {
        this.blackboard = blackboard;
        this.provider = provider;
    }

    @Override
    public Optional<ScoredPick> choose() {
        List<String> tagsToMatch = tagsOf(blackboard.reference());
        if (tagsToMatch.isEmpty() || blackboard.pool().isEmpty()) {
            blackboard.resign(this);
            return Optional.empty();
        }
        int bestTagCount = 0;
        Candidate bestTagMatch = null;
        for (Candidate song : blackboard.pool()) {
            List<String> songTags = tagsOf(song);
            int tagMatchCount = 0;
            for (String tag : tagsToMatch) {
                if (songTags.contains(tag)) tagMatchCount++;
            }
            if (tagMatchCount > bestTagCount) {
                bestTagCount = tagMatchCount;
                bestTagMatch = song;
            }
        }
        if (bestTagMatch == null) {
            logger.debug("No pool candidate shares a tag with {}", blackboard.reference().id());
            blackboard.resign(this);
            return Optional.empty();
        }
        double score = (bestTagCount / (double) tagsToMatch.size()) * 100.0;
        blackboard.replaceAssumption(this, bestTagMatch, REASON, score);
        return Optional.of(new ScoredPick(bestTagMatch, score));
    }

    /**
     * Cached tags of a candidate, fetching them on first access.
     */
    List<String> tagsOf(Candidate song) {
        if (!song.hasTags()) {
            List<String> fetched = provider.getTopTags(song.artist(), song.name(), TAG_LIMIT);
            song.setTags(fetched.size() > TAG_LIMIT ? fetched.subList(0, TAG_LIMIT) : fetched);
            logger.debug("Tagged {} with {}", song.id(), song.tags());
        }
        return song.tags();
    }

    @Override
    public void onFeedback(Candidate candidate, Feedback feedback) {
        // re-derived from scratch on the next choose()
        blackboard.resign(this);
    }
}
