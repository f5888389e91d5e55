package com.songadvisor.recommender;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.songadvisor.recommender.TestTracks.candidate;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Bucket selection, strategy fallback and the feedback-driven state machine of the playcount matcher.
 */
public class PlaycountSourceTest {
    private Blackboard blackboard;
    private PlaycountSource source;

    @BeforeEach
    void setUp() {
        blackboard = new Blackboard();
        source = new PlaycountSource(blackboard);
        TestTracks.seed(blackboard, candidate("Seed", "Track", 100, null));
    }

    private Candidate pool(String name, long playcount) {
        Candidate song = candidate("Artist " + name, name, playcount, null);
        blackboard.admit(song);
        return song;
    }

    @Test
    void testClosestAndALotMore() {
        Candidate ninety = pool("ninety", 90);
        pool("one-fifty", 150);
        Candidate twoHundred = pool("two-hundred", 200);

        ScoredPick closest = source.choose().orElseThrow();
        assertSame(ninety, closest.candidate());
        assertEquals(90.0, closest.score(), 1e-9);
        assertEquals(PlaycountStrategy.CLOSEST, source.strategy());

        source.setStrategy(PlaycountStrategy.A_LOT_MORE);
        ScoredPick aLotMore = source.choose().orElseThrow();
        assertSame(twoHundred, aLotMore.candidate());
        assertEquals(100.0, aLotMore.score(), 1e-9);
        assertEquals("Try a lot more plays", blackboard.retractableHypothesisOf(source).orElseThrow().reason());
    }

    @Test
    void testDirectionalBuckets() {
        pool("eighty", 80);
        Candidate ninetyFive = pool("ninety-five", 95);
        Candidate oneTen = pool("one-ten", 110);
        pool("three-hundred", 300);

        source.setStrategy(PlaycountStrategy.MORE);
        ScoredPick more = source.choose().orElseThrow();
        assertSame(oneTen, more.candidate());
        assertEquals(90.0, more.score(), 1e-9);

        source.setStrategy(PlaycountStrategy.A_LOT_FEWER);
        ScoredPick aLotFewer = source.choose().orElseThrow();
        assertEquals("eighty", aLotFewer.candidate().name());
        assertEquals(20.0, aLotFewer.score(), 1e-9);

        source.setStrategy(PlaycountStrategy.CLOSEST);
        assertSame(ninetyFive, source.choose().orElseThrow().candidate());
    }

    @Test
    void testDisplacedClosestMovesToFewerBucket() {
        Candidate eighty = pool("eighty", 80);
        pool("ninety-five", 95);

        source.setStrategy(PlaycountStrategy.FEWER);
        ScoredPick fewer = source.choose().orElseThrow();

        assertSame(eighty, fewer.candidate());
        assertEquals(80.0, fewer.score(), 1e-9);
    }

    @Test
    void testFallbackToPairedStrategyThenClosest() {
        Candidate fifty = pool("fifty", 50);
        Candidate ninety = pool("ninety", 90);

        source.setStrategy(PlaycountStrategy.A_LOT_MORE);
        assertSame(ninety, source.choose().orElseThrow().candidate());
        assertEquals(PlaycountStrategy.CLOSEST, source.strategy());

        source.setStrategy(PlaycountStrategy.A_LOT_FEWER);
        assertSame(fifty, source.choose().orElseThrow().candidate());
        assertEquals(PlaycountStrategy.A_LOT_FEWER, source.strategy());
    }

    @Test
    void testFallbackFromMoreToALotMore() {
        Candidate oneFifty = pool("one-fifty", 150);

        source.setStrategy(PlaycountStrategy.MORE);
        ScoredPick pick = source.choose().orElseThrow();

        assertSame(oneFifty, pick.candidate());
        assertEquals(50.0, pick.score(), 1e-9);
        assertEquals(PlaycountStrategy.A_LOT_MORE, source.strategy());
    }

    @Test
    void testDisplacedClosestMovesToMoreBucket() {
        Candidate oneTwenty = pool("one-twenty", 120);
        pool("one-ten", 110);

        source.setStrategy(PlaycountStrategy.MORE);
        ScoredPick pick = source.choose().orElseThrow();

        assertSame(oneTwenty, pick.candidate());
        assertEquals(80.0, pick.score(), 1e-9);
        assertEquals(PlaycountStrategy.MORE, source.strategy());
    }

    @Test
    void testEmptyPoolYieldsNoResult() {
        assertEquals(Optional.empty(), source.choose());
    }

    @Test
    void testAcceptedFeedbackBoostsScores() {
        Candidate ninety = pool("ninety", 90);
        source.choose();

        source.onFeedback(ninety, Feedback.ACCEPTED);

        assertEquals(SourceQuality.GOOD, source.quality());
        assertEquals(112.5, source.choose().orElseThrow().score(), 1e-9);
        assertEquals(List.of(PlaycountStrategy.MORE, PlaycountStrategy.A_LOT_MORE), source.pendingStrategies(true));
    }

    @Test
    void testRejectionsWalkTheQueueThenPenalize() {
        Candidate ninety = pool("ninety", 90);
        source.choose();

        source.onFeedback(ninety, Feedback.REJECTED);
        assertEquals(PlaycountStrategy.A_LOT_MORE, source.strategy());
        assertTrue(blackboard.retractableHypothesisOf(source).isEmpty());

        source.onFeedback(ninety, Feedback.REJECTED);
        assertEquals(PlaycountStrategy.MORE, source.strategy());
        assertEquals(SourceQuality.NEUTRAL, source.quality());

        source.onFeedback(ninety, Feedback.REJECTED);
        assertNull(source.strategy());
        assertEquals(SourceQuality.POOR, source.quality());
        assertEquals(2, source.pendingStrategies(true).size());

        ScoredPick penalized = source.choose().orElseThrow();
        assertEquals(PlaycountStrategy.CLOSEST, source.strategy());
        assertEquals(67.5, penalized.score(), 1e-9);
    }

    @Test
    void testRejectingLouderTrackTriesFewerPlays() {
        Candidate twoHundred = pool("two-hundred", 200);

        source.onFeedback(twoHundred, Feedback.REJECTED);

        assertEquals(PlaycountStrategy.A_LOT_FEWER, source.strategy());
        assertEquals(List.of(PlaycountStrategy.FEWER), source.pendingStrategies(false));
    }

    @Test
    void testReusesHypothesisForSamePick() {
        pool("ninety", 90);
        source.choose();
        Hypothesis first = blackboard.retractableHypothesisOf(source).orElseThrow();

        source.choose();

        assertSame(first, blackboard.retractableHypothesisOf(source).orElseThrow());
        assertEquals(2, blackboard.hypotheses().size());
    }
}
