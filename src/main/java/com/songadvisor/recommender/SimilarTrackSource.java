package com.songadvisor.recommender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Fills the pool with the top track of artists similar to the reference artist.
 * <p>
 * Workflow:
 * <ul>
 *   <li>On the first request for an artist, fetch its similar artists (most similar first) and the
 *       top track of each, then reverse the list: the feed hands out the least similar track first
 *       and keeps the closest matches for later requests.</li>
 *   <li>Each requested slot takes feed items until one is new to the blackboard, expanding it with a
 *       full track lookup. Tracks already seeded, liked, disliked or pooled are skipped.</li>
 *   <li>An exhausted feed admits fewer candidates than requested.</li>
 * </ul>
 * When the user rejects a track this source produced, it refills one slot from the current
 * reference artist's feed.
 *
 * @author Song Advisor Team
 * @since 1.0
 */
public class SimilarTrackSource implements KnowledgeSource {
    private static final Logger logger = LoggerFactory.getLogger(SimilarTrackSource.class);

    private final Blackboard blackboard;
    private final MusicDataProviderInterface provider;
    private final int similarArtistLimit;
    private String thinkingAbout;
    private Deque<TrackInfo> dataFeed = new ArrayDeque<>();

    public SimilarTrackSource(Blackboard blackboard, MusicDataProviderInterface provider, int similarArtistLimit) {
        this.blackboard = blackboard;
        this.provider = provider;
        this.similarArtistLimit = similarArtistLimit;
    }

    /**
     * Admits up to {@code count} new candidates related to {@code artist}.
     * @param artist seed artist
     * @param track seed track (informational; the feed is keyed by artist)
     * @param count number of slots to fill
     * @return number of candidates actually admitted
     * @throws ProviderException if a similar-artist or top-track lookup fails
     */
    public int gather(String artist, String track, int count) {
        if (!artist.equals(thinkingAbout)) {
            dataFeed = buildFeed(artist);
            thinkingAbout = artist;
        }
        int admitted = 0;
        while (count > 0) {
            Optional<Candidate> unique = nextUnique();
            if (unique.isPresent()) {
                blackboard.admit(unique.get());
                unique.get().subscribe(this);
                admitted++;
            }
            count--;
        }
        logger.debug("Gathered {} candidate(s) for {} - {}; {} left in feed", admitted, artist, track, dataFeed.size());
        return admitted;
    }

    private Deque<TrackInfo> buildFeed(String artist) {
        List<String> similarArtists = provider.getSimilarArtists(artist, similarArtistLimit);
        List<TrackInfo> topTracks = new ArrayList<>();
        for (String similar : similarArtists) {
            try {
                topTracks.add(provider.getTopTrack(similar));
            } catch (ProviderException e) {
                throw new ProviderException("There was an error looking up top tracks for artists similar to " + artist, e);
            }
        }
        Collections.reverse(topTracks);
        logger.info("Built feed of {} top tracks for artists similar to {}", topTracks.size(), artist);
        return new ArrayDeque<>(topTracks);
    }

    private Optional<Candidate> nextUnique() {
        while (!dataFeed.isEmpty()) {
            TrackInfo listed = dataFeed.pollFirst();
            Candidate fetched = new Candidate(provider.getTrackInfo(listed.artist(), listed.name()), this);
            Set<String> considered = blackboard.consideredIds();
            if (!considered.contains(fetched.id())) {
                return Optional.of(fetched);
            }
            logger.debug("Skipping already considered track {}", fetched.id());
        }
        return Optional.empty();
    }

    int remainingFeed() {
        return dataFeed.size();
    }

    @Override
    public void onFeedback(Candidate candidate, Feedback feedback) {
        if (feedback == Feedback.REJECTED && candidate.origin() == this && blackboard.solving() != null) {
            Candidate reference = blackboard.reference();
            gather(reference.artist(), reference.name(), 1);
        }
    }
}
