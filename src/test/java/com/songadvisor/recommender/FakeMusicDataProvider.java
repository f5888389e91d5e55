package com.songadvisor.recommender;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory provider for tests. Unknown tracks and artists without a top track raise
 * {@link ProviderException}, like the real client.
 */
class FakeMusicDataProvider implements MusicDataProviderInterface {
    private final Map<String, TrackInfo> tracks = new HashMap<>();
    private final Map<String, List<String>> similar = new HashMap<>();
    private final Map<String, TrackInfo> topTracks = new HashMap<>();
    private final Map<String, List<String>> tags = new HashMap<>();
    final List<String> calls = new ArrayList<>();

    FakeMusicDataProvider track(String artist, String name, long playcount, String... trackTags) {
        TrackInfo info = new TrackInfo(artist, name, playcount / 10, 200_000, playcount, "https://example.test/" + name, Map.of());
        tracks.put(artist + " - " + name, info);
        tags.put(artist + " - " + name, List.of(trackTags));
        return this;
    }

    FakeMusicDataProvider similar(String artist, String... artists) {
        similar.put(artist, List.of(artists));
        return this;
    }

    FakeMusicDataProvider topTrack(String artist, String name) {
        topTracks.put(artist, TrackInfo.of(artist, name));
        return this;
    }

    long callCount(String method) {
        return calls.stream().filter(c -> c.startsWith(method + ":")).count();
    }

    @Override
    public TrackInfo getTrackInfo(String artist, String track) {
        calls.add("getTrackInfo:" + artist + " - " + track);
        TrackInfo info = tracks.get(artist + " - " + track);
        if (info == null) {
            throw new ProviderException("Track not found: " + artist + " - " + track);
        }
        return info;
    }

    @Override
    public List<String> getSimilarArtists(String artist, int limit) {
        calls.add("getSimilarArtists:" + artist);
        List<String> names = similar.getOrDefault(artist, List.of());
        return names.subList(0, Math.min(limit, names.size()));
    }

    @Override
    public TrackInfo getTopTrack(String artist) {
        calls.add("getTopTrack:" + artist);
        TrackInfo top = topTracks.get(artist);
        if (top == null) {
            throw new ProviderException("No top track for " + artist);
        }
        return top;
    }

    @Override
    public List<String> getTopTags(String artist, String track, int limit) {
        calls.add("getTopTags:" + artist + " - " + track);
        // ignores the limit, as Last.fm does
        return tags.getOrDefault(artist + " - " + track, List.of());
    }
}
