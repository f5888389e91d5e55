package com.songadvisor.recommender;

import java.util.Optional;

/**
 * A knowledge source that competes in arbitration by proposing its single best candidate.
 */
public interface ScoringSource extends KnowledgeSource {
    /**
     * Examines the pool against the current reference track and registers a retractable
     * hypothesis for the winner.
     * @return the winner and its score, or empty when this source has nothing to propose
     */
    Optional<ScoredPick> choose();
}
