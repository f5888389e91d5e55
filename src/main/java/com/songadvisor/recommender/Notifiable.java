package com.songadvisor.recommender;

/**
 * Capability of receiving feedback about a candidate the implementor subscribed to.
 * Candidates hold references to this interface only, never to concrete sources.
 */
public interface Notifiable {
    /**
     * Called synchronously from {@link Candidate#notify(Feedback)}, in subscription order.
     * @param candidate the candidate the user responded to
     * @param feedback the user's response
     */
    void onFeedback(Candidate candidate, Feedback feedback);
}
