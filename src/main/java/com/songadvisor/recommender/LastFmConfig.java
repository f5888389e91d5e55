package com.songadvisor.recommender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Explicit configuration handed to {@link LastFmClient} and the session at construction.
 * <p>
 * {@link #fromEnvironment()} reads each key from the environment first and falls back to a
 * system property of the same name:
 * <ul>
 *   <li>{@code LASTFM_API_KEY} (required)</li>
 *   <li>{@code LASTFM_BASE_URL} (default {@value #DEFAULT_BASE_URL})</li>
 *   <li>{@code LASTFM_USER_AGENT}</li>
 *   <li>{@code ADVISOR_SIMILAR_ARTIST_LIMIT} (default 20)</li>
 *   <li>{@code ADVISOR_INITIAL_POOL_SIZE} (default 4)</li>
 *   <li>{@code ADVISOR_REFILL_COUNT} (default 4)</li>
 * </ul>
 *
 * @author Song Advisor Team
 * @since 1.0
 */
public record LastFmConfig(
    String apiKey,
    String baseUrl,
    String userAgent,
    int similarArtistLimit,
    int initialPoolSize,
    int refillCount
) {
    private static final Logger logger = LoggerFactory.getLogger(LastFmConfig.class);

    public static final String DEFAULT_BASE_URL = "https://ws.audioscrobbler.com/2.0/";
    public static final String DEFAULT_USER_AGENT = "SongAdvisor/1.0";
    public static final int DEFAULT_SIMILAR_ARTIST_LIMIT = 20;
    public static final int DEFAULT_POOL_SIZE = 4;

    public LastFmConfig {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("A Last.fm API key is required (set LASTFM_API_KEY)");
        }
        if (baseUrl == null || baseUrl.isBlank()) baseUrl = DEFAULT_BASE_URL;
        if (userAgent == null || userAgent.isBlank()) userAgent = DEFAULT_USER_AGENT;
        if (similarArtistLimit <= 0) similarArtistLimit = DEFAULT_SIMILAR_ARTIST_LIMIT;
        if (initialPoolSize <= 0) initialPoolSize = DEFAULT_POOL_SIZE;
        if (refillCount <= 0) refillCount = DEFAULT_POOL_SIZE;
    }

    public static LastFmConfig withApiKey(String apiKey) {
        return new LastFmConfig(apiKey, DEFAULT_BASE_URL, DEFAULT_USER_AGENT,
            DEFAULT_SIMILAR_ARTIST_LIMIT, DEFAULT_POOL_SIZE, DEFAULT_POOL_SIZE);
    }

    public static LastFmConfig fromEnvironment() {
        return new LastFmConfig(
            envOrProp("LASTFM_API_KEY", null),
            envOrProp("LASTFM_BASE_URL", DEFAULT_BASE_URL),
            envOrProp("LASTFM_USER_AGENT", DEFAULT_USER_AGENT),
            intSetting("ADVISOR_SIMILAR_ARTIST_LIMIT", DEFAULT_SIMILAR_ARTIST_LIMIT),
            intSetting("ADVISOR_INITIAL_POOL_SIZE", DEFAULT_POOL_SIZE),
            intSetting("ADVISOR_REFILL_COUNT", DEFAULT_POOL_SIZE)
        );
    }

    static String envOrProp(String key, String defaultVal) {
        String ev = System.getenv(key);
        if (ev != null && !ev.isBlank()) return ev;
        String prop = System.getProperty(key);
        return prop != null ? prop : defaultVal;
    }

    private static int intSetting(String key, int defaultVal) {
        String raw = envOrProp(key, null);
        if (raw == null) return defaultVal;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric value '{}' for {}; using {}", raw, key, defaultVal);
            return defaultVal;
        }
    }

    @Override
    public String toString() {
        // keep the key out of logs
        return "LastFmConfig[baseUrl=" + baseUrl + ", userAgent=" + userAgent
            + ", similarArtistLimit=" + similarArtistLimit + ", initialPoolSize=" + initialPoolSize
            + ", refillCount=" + refillCount + "]";
    }
}
