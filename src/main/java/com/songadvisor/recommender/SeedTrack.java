package com.songadvisor.recommender;

/**
 * Artist and track the user wants recommendations for.
 */
public record SeedTrack(String artist, String track) {
    public SeedTrack {
        if (artist == null || artist.isBlank() || track == null || track.isBlank()) {
            throw new IllegalArgumentException("Both artist and track are required");
        }
        artist = artist.trim();
        track = track.trim();
    }
}
