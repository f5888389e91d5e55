package com.songadvisor.recommender;

/**
 * A scoring source's best candidate together with the score it assigned.
 */
public record ScoredPick(Candidate candidate, double score) {}
