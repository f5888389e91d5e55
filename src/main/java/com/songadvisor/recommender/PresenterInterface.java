package com.songadvisor.recommender;

import java.util.List;

/**
 * Interface for the user-facing side of a recommendation session.
 */
public interface PresenterInterface {
    /**
     * Asks the user for the track to base recommendations on.
     * @return artist and track typed by the user
     */
    SeedTrack promptSeed();

    /**
     * Shows the blackboard before each recommendation.
     * @param pool live candidates
     * @param hypotheses hypothesis log in recording order
     * @param solving current reference hypothesis (may be null)
     */
    void showCycleState(List<Candidate> pool, List<Hypothesis> hypotheses, Hypothesis solving);

    /**
     * Presents a recommendation and reads the verdict.
     * @param candidate recommended track
     * @return the user's feedback
     */
    Feedback presentCandidate(Candidate candidate);

    /**
     * After a liked track, asks whether the user wants another recommendation.
     */
    boolean askForAnother();

    /**
     * Progress line while lookups run.
     * @param step short description of the work in progress
     */
    void announceWorking(String step);

    void announceExhausted();

    void announceSessionEnd();
}
