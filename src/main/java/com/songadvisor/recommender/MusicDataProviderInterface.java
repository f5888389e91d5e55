package com.songadvisor.recommender;

import java.util.List;

/**
 * Interface for the external music metadata provider consumed by the knowledge sources.
 * Every method either returns a result or throws {@link ProviderException}; nothing is retried.
 */
public interface MusicDataProviderInterface {
    /**
     * Fetches full metadata (listeners, duration, playcount, url) for one track.
     * @param artist artist name
     * @param track track name
     * @return track record
     * @throws ProviderException if the lookup fails or the track is unknown
     */
    TrackInfo getTrackInfo(String artist, String track);

    /**
     * Lists artists similar to the given one.
     * @param artist artist name
     * @param limit maximum number of artists requested
     * @return artist names, most similar first
     */
    List<String> getSimilarArtists(String artist, int limit);

    /**
     * Fetches the single most popular track of an artist.
     * @param artist artist name
     * @return identity of the top track (other fields may be absent)
     * @throws ProviderException if the artist has no top track
     */
    TrackInfo getTopTrack(String artist);

    /**
     * Lists the top tags of a track. The provider may return more than {@code limit} entries.
     * @param artist artist name
     * @param track track name
     * @param limit requested number of tags (advisory)
     * @return tag names, most relevant first
     */
    List<String> getTopTags(String artist, String track, int limit);
}
