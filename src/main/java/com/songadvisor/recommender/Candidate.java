package com.songadvisor.recommender;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A track under consideration as a recommendation.
 * <p>
 * Identity is the (artist, track name) pair, rendered by {@link #id()} as {@code "artist - track"}.
 * Descriptive fields come from a provider {@link TrackInfo} and never change; the top tags are
 * fetched lazily by the tag matcher and cached here.
 * <p>
 * Each candidate is also a notification channel: sources that proposed it subscribe and receive
 * the user's feedback through {@link #notify(Feedback)}.
 *
 * @author Song Advisor Team
 * @since 1.0
 */
public class Candidate {
    private final String artist;
    private final String name;
    private final long listeners;
    private final long duration;
    private final long playcount;
    private final String url;
    private final Map<String, Object> extras;
    private final KnowledgeSource origin;
    private List<String> tags;
    private final List<Notifiable> subscribers = new ArrayList<>();

    public Candidate(TrackInfo info, KnowledgeSource origin) {
        if (info == null || info.artist() == null || info.name() == null) {
            throw new IllegalArgumentException("Candidate requires a track with artist and name");
        }
        this.artist = info.artist();
        this.name = info.name();
        this.listeners = info.listeners();
        this.duration = info.duration();
        this.playcount = info.playcount();
        this.url = info.url();
        this.extras = info.extras();
        this.origin = origin;
    }

    public String id() {
        return artist + " - " + name;
    }

    public String artist() { return artist; }
    public String name() { return name; }
    public long listeners() { return listeners; }
    public long duration() { return duration; }
    public long playcount() { return playcount; }
    public String url() { return url; }
    public Map<String, Object> extras() { return extras; }

    /** Source that fetched this candidate. */
    public KnowledgeSource origin() { return origin; }

    /**
     * Cached top tags, or null when they have not been fetched yet.
     */
    public List<String> tags() {
        return tags;
    }

    public boolean hasTags() {
        return tags != null;
    }

    public void setTags(List<String> tags) {
        this.tags = tags == null ? null : List.copyOf(tags);
    }

    /**
     * Adds a subscriber at the end of the delivery order. Subscribing twice has no effect.
     */
    public void subscribe(Notifiable subscriber) {
        if (subscriber != null && !subscribers.contains(subscriber)) {
            subscribers.add(subscriber);
        }
    }

    public void unsubscribe(Notifiable subscriber) {
        subscribers.remove(subscriber);
    }

    void clearSubscribers() {
        subscribers.clear();
    }

    public List<Notifiable> subscribers() {
        return Collections.unmodifiableList(subscribers);
    }

    /**
     * Delivers feedback to every subscriber in subscription order. Iterates over a snapshot, so a
     * callback that changes the subscriber list only affects later notifications.
     * @param feedback the user's response
     */
    public void notify(Feedback feedback) {
        for (Notifiable subscriber : List.copyOf(subscribers)) {
            subscriber.onFeedback(this, feedback);
        }
    }

    @Override
    public String toString() {
        return id();
    }
}
