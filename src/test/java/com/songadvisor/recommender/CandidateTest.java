package com.songadvisor.recommender;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.songadvisor.recommender.TestTracks.candidate;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Candidate identity and the feedback notification channel.
 */
public class CandidateTest {

    @Test
    void testIdentityIsArtistAndTrack() {
        Candidate song = new Candidate(new TrackInfo("Radiohead", "Creep", 10, 238000, 500, "u", Map.of("mbid", "x")), null);
        assertEquals("Radiohead - Creep", song.id());
        assertEquals("x", song.extras().get("mbid"));
        assertFalse(song.hasTags());
        assertEquals(song.id(), candidate("Radiohead", "Creep", 1, null).id());
    }

    @Test
    void testNotifyDeliversInSubscriptionOrderWithoutChangingSubscribers() {
        Candidate song = candidate("Radiohead", "Creep", 1, null);
        List<String> delivered = new ArrayList<>();
        Notifiable first = (c, f) -> delivered.add("first:" + f);
        Notifiable second = (c, f) -> delivered.add("second:" + f);
        song.subscribe(first);
        song.subscribe(second);
        song.subscribe(first);

        song.notify(Feedback.REJECTED);
        song.notify(Feedback.ACCEPTED);

        assertEquals(List.of("first:REJECTED", "second:REJECTED", "first:ACCEPTED", "second:ACCEPTED"), delivered);
        assertEquals(List.of(first, second), song.subscribers());
    }

    @Test
    void testUnsubscribeDuringNotifyOnlyAffectsLaterNotifications() {
        Candidate song = candidate("Radiohead", "Creep", 1, null);
        List<String> delivered = new ArrayList<>();
        Notifiable second = (c, f) -> delivered.add("second");
        Notifiable first = new Notifiable() {
            @Override
            public void onFeedback(Candidate c, Feedback f) {
                delivered.add("first");
                c.unsubscribe(second);
            }
        };
        song.subscribe(first);
        song.subscribe(second);

        song.notify(Feedback.REJECTED);
        song.notify(Feedback.REJECTED);

        assertEquals(List.of("first", "second", "first"), delivered);
    }

    @Test
    void testFeedbackFromAnswer() {
        assertEquals(Feedback.ACCEPTED, Feedback.fromAnswer(" YES "));
        assertEquals(Feedback.REJECTED, Feedback.fromAnswer("y"));
        assertEquals(Feedback.REJECTED, Feedback.fromAnswer(""));
        assertEquals(Feedback.REJECTED, Feedback.fromAnswer(null));
    }
}
