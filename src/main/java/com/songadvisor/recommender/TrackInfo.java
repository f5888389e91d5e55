package com.songadvisor.recommender;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable track record as returned by the music data provider.
 * <p>
 * Numeric fields the provider omitted are 0. Provider fields without a named component
 * (mbid, album, wiki, streamable, ...) are kept in {@code extras} untouched.
 *
 * @author Song Advisor Team
 * @since 1.0
 */
public record TrackInfo(
    String artist,
    String name,
    long listeners,
    long duration,
    long playcount,
    String url,
    Map<String, Object> extras
) {
    public TrackInfo {
        extras = extras == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    /**
     * Minimal record carrying identity only, as produced by top-track listings.
     */
    public static TrackInfo of(String artist, String name) {
        return new TrackInfo(artist, name, 0, 0, 0, null, Map.of());
    }
}
