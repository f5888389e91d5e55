package com.songadvisor.recommender;

import java.util.Locale;

/**
 * A claim about a candidate, with provenance.
 * <p>
 * Retractable hypotheses ("assumptions") are provisional picks a scoring source may withdraw.
 * Permanent hypotheses ("assertions") record ground truth such as the seed track or the user's
 * verdict; the blackboard refuses to retract them.
 *
 * @author Song Advisor Team
 * @since 1.0
 */
public final class Hypothesis {
    private final Candidate candidate;
    private final KnowledgeSource source;
    private final String reason;
    private final Double score;
    private final boolean retractable;

    private Hypothesis(Candidate candidate, KnowledgeSource source, String reason, Double score, boolean retractable) {
        if (candidate == null) {
            throw new IllegalArgumentException("Hypothesis requires a candidate");
        }
        this.candidate = candidate;
        this.source = source;
        this.reason = reason;
        this.score = score;
        this.retractable = retractable;
    }

    public static Hypothesis retractable(Candidate candidate, KnowledgeSource source, String reason, Double score) {
        return new Hypothesis(candidate, source, reason, score, true);
    }

    public static Hypothesis permanent(Candidate candidate, KnowledgeSource source, String reason) {
        return new Hypothesis(candidate, source, reason, null, false);
    }

    public Candidate candidate() { return candidate; }
    public KnowledgeSource source() { return source; }
    public String reason() { return reason; }

    /** Score, or null when the maker assigned none. */
    public Double score() { return score; }

    public boolean isRetractable() { return retractable; }

    @Override
    public String toString() {
        return (retractable ? "Assumption" : "Assertion") + "[" + candidate.id() + ", " + reason
            + (score != null ? String.format(Locale.ROOT, ", %.2f", score) : "") + ", by " + (source == null ? "?" : source.name()) + "]";
    }
}
