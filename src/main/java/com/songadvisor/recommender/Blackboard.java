package com.songadvisor.recommender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Shared workspace coordinating the knowledge sources.
 * <p>
 * Holds three pieces of state:
 * <ul>
 *   <li>{@code pool}: live candidates in admission order (also the display order).</li>
 *   <li>{@code hypotheses}: append-ordered log of every claim made, never reordered.</li>
 *   <li>{@code solving}: the permanent hypothesis whose candidate is the current reference track.</li>
 * </ul>
 * Execution is single-threaded; every mutation completes inside the call that requested it.
 *
 * @author Song Advisor Team
 * @since 1.0
 */
public class Blackboard {
    private static final Logger logger = LoggerFactory.getLogger(Blackboard.class);

    private final List<Candidate> pool = new ArrayList<>();
    private final List<Hypothesis> hypotheses = new ArrayList<>();
    private Hypothesis solving;

    /**
     * Adds a candidate to the end of the pool.
     * @param candidate candidate to admit
     * @throws InvariantViolationException if a candidate with the same identity is already pooled
     */
    public void admit(Candidate candidate) {
        if (candidate == null) {
            logger.warn("admit called with null candidate.");
            throw new IllegalArgumentException("Candidate cannot be null");
        }
        if (inPool(candidate.id())) {
            throw new InvariantViolationException("Candidate already in pool: " + candidate.id());
        }
        pool.add(candidate);
        logger.debug("Admitted {} (pool size {})", candidate.id(), pool.size());
    }

    /**
     * Removes a candidate from the pool and drops its subscribers.
     * @return true if the candidate was pooled
     */
    public boolean evict(Candidate candidate) {
        boolean removed = pool.remove(candidate);
        if (removed) {
            candidate.clearSubscribers();
            logger.debug("Evicted {} (pool size {})", candidate.id(), pool.size());
        }
        return removed;
    }

    /**
     * Evicts every pooled candidate.
     */
    public void clearPool() {
        for (Candidate candidate : List.copyOf(pool)) {
            evict(candidate);
        }
    }

    public void record(Hypothesis hypothesis) {
        if (hypothesis == null) {
            logger.warn("record called with null hypothesis.");
            throw new IllegalArgumentException("Hypothesis cannot be null");
        }
        hypotheses.add(hypothesis);
        logger.debug("Recorded {}", hypothesis);
    }

    /**
     * Removes exactly one hypothesis from the log.
     * @throws InvariantViolationException if the hypothesis is permanent
     */
    public void retract(Hypothesis hypothesis) {
        if (hypothesis == null) {
            logger.warn("retract called with null hypothesis.");
            throw new IllegalArgumentException("Hypothesis cannot be null");
        }
        if (!hypothesis.isRetractable()) {
            throw new InvariantViolationException("Permanent hypotheses may not be retracted: " + hypothesis);
        }
        // identity match: two equal-looking claims are still separate entries
        for (int i = 0; i < hypotheses.size(); i++) {
            if (hypotheses.get(i) == hypothesis) {
                hypotheses.remove(i);
                logger.debug("Retracted {}", hypothesis);
                return;
            }
        }
    }

    public List<Candidate> pool() {
        return Collections.unmodifiableList(pool);
    }

    public List<Hypothesis> hypotheses() {
        return Collections.unmodifiableList(hypotheses);
    }

    public Hypothesis solving() {
        return solving;
    }

    public void setSolving(Hypothesis solving) {
        if (solving != null && solving.isRetractable()) {
            throw new InvariantViolationException("Reference track must come from a permanent hypothesis: " + solving);
        }
        this.solving = solving;
    }

    /**
     * Candidate of the current reference hypothesis.
     * @throws IllegalStateException before the first seed has been loaded
     */
    public Candidate reference() {
        if (solving == null) {
            throw new IllegalStateException("No reference track has been loaded");
        }
        return solving.candidate();
    }

    public boolean inPool(String id) {
        for (Candidate candidate : pool) {
            if (candidate.id().equals(id)) return true;
        }
        return false;
    }

    /**
     * Ids a newly fetched candidate must not collide with: every candidate carrying a
     * permanent hypothesis (seed, liked, disliked) plus everything in the pool.
     */
    public Set<String> consideredIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (Hypothesis hypothesis : hypotheses) {
            if (!hypothesis.isRetractable()) ids.add(hypothesis.candidate().id());
        }
        for (Candidate candidate : pool) ids.add(candidate.id());
        return ids;
    }

    /**
     * Registers a source's pick as its single retractable hypothesis.
     * <p>
     * If the source already holds a retractable hypothesis for this very candidate it is kept and
     * returned unchanged. Otherwise the old one (if any) is retracted before the new one is
     * recorded, and the source subscribes to the picked candidate. A re-admitted copy of an
     * earlier pick is a new candidate: the hypothesis on the evicted copy is replaced.
     * @return the hypothesis now held by the source for this pick
     */
    public Hypothesis replaceAssumption(KnowledgeSource source, Candidate pick, String reason, Double score) {
        Optional<Hypothesis> held = retractableHypothesisOf(source);
        if (held.isPresent()) {
            if (held.get().candidate() == pick) {
                return held.get();
            }
            retract(held.get());
        }
        Hypothesis assumption = Hypothesis.retractable(pick, source, reason, score);
        record(assumption);
        pick.subscribe(source);
        return assumption;
    }

    /**
     * Withdraws the source's retractable hypothesis if it holds one.
     * @return the withdrawn hypothesis
     */
    public Optional<Hypothesis> resign(KnowledgeSource source) {
        Optional<Hypothesis> held = retractableHypothesisOf(source);
        held.ifPresent(this::retract);
        return held;
    }

    /**
     * The retractable hypothesis currently held by a source, if any.
     */
    public Optional<Hypothesis> retractableHypothesisOf(KnowledgeSource source) {
        for (Hypothesis hypothesis : hypotheses) {
            if (hypothesis.source() == source && hypothesis.isRetractable()) {
                return Optional.of(hypothesis);
            }
        }
        return Optional.empty();
    }
}
