package com.songadvisor.recommender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks a candidate by comparing its playcount with the reference track's, adapting its strategy
 * to the user's answers.
 * <p>
 * Workflow:
 * <ul>
 *   <li>One pass over the pool fills five buckets: the closest playcount, the largest increase
 *       ("a lot more"), the largest decrease ("a lot fewer") and the nearest candidates above and
 *       below the closest one ("more", "fewer"). When a new closest is found, the previous closest
 *       moves to "more" or "fewer" depending on which side of the new one it lies.</li>
 *   <li>The closest and nearest-directional buckets score {@code 100 - pctDiff}; the extreme buckets
 *       score {@code pctDiff}, so bigger jumps score higher.</li>
 *   <li>The current strategy picks a bucket. An empty bucket falls back to its paired strategy,
 *       then to CLOSEST.</li>
 *   <li>The score is scaled by the source's {@link SourceQuality}.</li>
 * </ul>
 * Feedback:
 * <ul>
 *   <li>Accepted: quality becomes GOOD and both strategy queues are refilled.</li>
 *   <li>Rejected: the held hypothesis is withdrawn and the next strategy is taken from the "more"
 *       queue when the rejected track had fewer plays than the reference, from the "fewer" queue
 *       otherwise. An empty queue means every strategy in that direction failed: quality becomes
 *       POOR, the queues are refilled and the next pick falls back to CLOSEST.</li>
 * </ul>
 *
 * @author Song Advisor Team
 * @since 1.0
 */
public class PlaycountSource implements ScoringSource {
    private static final Logger logger = LoggerFactory.getLogger(PlaycountSource.class);

    private final Blackboard blackboard;
    private Deque<PlaycountStrategy> moreStrategies;
    private Deque<PlaycountStrategy> fewerStrategies;
    private PlaycountStrategy tryThis;
    private SourceQuality quality = SourceQuality.NEUTRAL;

    public PlaycountSource(Blackboard blackboard) {
        this.blackboard = blackboard;
        initStrategies();
    }

    private void initStrategies() {
        moreStrategies = new ArrayDeque<>(List.of(PlaycountStrategy.MORE, PlaycountStrategy.A_LOT_MORE));
        fewerStrategies = new ArrayDeque<>(List.of(PlaycountStrategy.FEWER, PlaycountStrategy.A_LOT_FEWER));
    }

    private static final class Position {
        long delta;
        Candidate reco;
        double score;

        Position(long delta) {
            this.delta = delta;
        }

        void take(long delta, Candidate reco, double score) {
            this.delta = delta;
            this.reco = reco;
            this.score = score;
        }

        void takeFrom(Position other) {
            take(other.delta, other.reco, other.score);
        }
    }

    @Override
    public Optional<ScoredPick> choose() {
        if (blackboard.pool().isEmpty()) {
            return Optional.empty();
        }
        long referencePlays = blackboard.reference().playcount();
        double denominator = Math.max(referencePlays, 1L);

        Map<PlaycountStrategy, Position> position = new EnumMap<>(PlaycountStrategy.class);
        position.put(PlaycountStrategy.CLOSEST, new Position(Long.MAX_VALUE));
        position.put(PlaycountStrategy.A_LOT_MORE, new Position(Long.MIN_VALUE));
        position.put(PlaycountStrategy.A_LOT_FEWER, new Position(Long.MAX_VALUE));
        position.put(PlaycountStrategy.MORE, new Position(Long.MAX_VALUE));
        position.put(PlaycountStrategy.FEWER, new Position(Long.MIN_VALUE));
        Position closest = position.get(PlaycountStrategy.CLOSEST);
        Position more = position.get(PlaycountStrategy.MORE);
        Position fewer = position.get(PlaycountStrategy.FEWER);
        Position aLotMore = position.get(PlaycountStrategy.A_LOT_MORE);
        Position aLotFewer = position.get(PlaycountStrategy.A_LOT_FEWER);

        for (Candidate song : blackboard.pool()) {
            long delta = song.playcount() - referencePlays;
            double pctDiff = Math.abs(delta / denominator * 100.0);
            if (Math.abs(delta) < Math.abs(closest.delta)) {
                // displaced closest keeps its score in the matching directional bucket
                if (closest.delta > delta) {
                    more.takeFrom(closest);
                } else if (closest.delta < delta) {
                    fewer.takeFrom(closest);
                }
                closest.take(delta, song, 100 - pctDiff);
            }
            if (delta > 0 && delta > aLotMore.delta) {
                aLotMore.take(delta, song, pctDiff);
            }
            if (delta < 0 && delta < aLotFewer.delta) {
                aLotFewer.take(delta, song, pctDiff);
            }
            if (delta > 0 && delta < more.delta && delta > closest.delta) {
                more.take(delta, song, 100 - pctDiff);
            }
            if (delta < 0 && delta > fewer.delta && delta < closest.delta) {
                fewer.take(delta, song, 100 - pctDiff);
            }
        }

        if (tryThis == null) {
            tryThis = PlaycountStrategy.CLOSEST;
        }
        Position bestIdea = priorityFallback(position);
        double score = quality.apply(bestIdea.score);
        blackboard.replaceAssumption(this, bestIdea.reco, "Try " + tryThis.label(), score);
        return Optional.of(new ScoredPick(bestIdea.reco, score));
    }

    private Position priorityFallback(Map<PlaycountStrategy, Position> position) {
        Position bestIdea = position.get(tryThis);
        if (bestIdea.reco == null) {
            PlaycountStrategy next = tryThis.paired();
            bestIdea = position.get(next);
            if (bestIdea.reco == null) {
                tryThis = PlaycountStrategy.CLOSEST;
                bestIdea = position.get(tryThis);
            } else {
                tryThis = next;
            }
        }
        return bestIdea;
    }

    @Override
    public void onFeedback(Candidate candidate, Feedback feedback) {
        if (feedback == Feedback.ACCEPTED) {
            quality = SourceQuality.GOOD;
            initStrategies();
            return;
        }
        blackboard.resign(this);
        tryThis = null;
        boolean fewerPlaysThanReference = candidate.playcount() < blackboard.reference().playcount();
        Deque<PlaycountStrategy> queue = fewerPlaysThanReference ? moreStrategies : fewerStrategies;
        if (!queue.isEmpty()) {
            tryThis = queue.pollLast();
            logger.debug("Rejected {}; next playcount strategy: {}", candidate.id(), tryThis);
        } else {
            logger.info("The playcount source has tried all its strategies without success. Applying a penalty to its suggestions.");
            quality = SourceQuality.POOR;
            initStrategies();
        }
    }

    /** Strategy for the next pick; null until the first choose() or after a rejection. */
    public PlaycountStrategy strategy() {
        return tryThis;
    }

    void setStrategy(PlaycountStrategy strategy) {
        this.tryThis = strategy;
    }

    public SourceQuality quality() {
        return quality;
    }

    List<PlaycountStrategy> pendingStrategies(boolean moreDirection) {
        return List.copyOf(moreDirection ? moreStrategies : fewerStrategies);
    }
}
