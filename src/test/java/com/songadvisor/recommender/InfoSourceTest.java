package com.songadvisor.recommender;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class InfoSourceTest {

    @Test
    void testLoadInstallsPermanentReference() {
        Blackboard blackboard = new Blackboard();
        FakeMusicDataProvider provider = new FakeMusicDataProvider().track("Seed", "Track", 1000, "rock");
        InfoSource source = new InfoSource(blackboard, provider);

        Candidate seed = source.load("Seed", "Track");

        assertEquals("Seed - Track", seed.id());
        assertSame(seed, blackboard.reference());
        assertFalse(blackboard.solving().isRetractable());
        assertEquals(HypothesisReason.INITIAL_SONG, blackboard.solving().reason());
        assertTrue(blackboard.pool().isEmpty());
        assertEquals(1, seed.subscribers().size());
        assertDoesNotThrow(() -> seed.notify(Feedback.REJECTED));
    }

    @Test
    void testRepeatedLoadReusesLastLookup() {
        Blackboard blackboard = new Blackboard();
        FakeMusicDataProvider provider = new FakeMusicDataProvider()
            .track("Seed", "Track", 1000)
            .track("Other", "Song", 10);
        InfoSource source = new InfoSource(blackboard, provider);

        source.load("Seed", "Track");
        source.load("Seed", "Track");
        assertEquals(1, provider.callCount("getTrackInfo"));

        source.load("Other", "Song");
        source.load("Seed", "Track");
        assertEquals(3, provider.callCount("getTrackInfo"));
        assertEquals(4, blackboard.hypotheses().size());
    }

    @Test
    void testUnknownTrackPropagatesProviderError() {
        InfoSource source = new InfoSource(new Blackboard(), new FakeMusicDataProvider());
        assertThrows(ProviderException.class, () -> source.load("Nobody", "Nothing"));
    }
}
