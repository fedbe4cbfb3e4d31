package io.x402.autopay.store;

import io.x402.autopay.MutableClock;
import io.x402.autopay.TestChallenges;
import io.x402.autopay.model.PendingChallenge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PendingChallengeStoreTest {

    private MutableClock clock;
    private PendingChallengeStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-01T12:00:00Z");
        store = new PendingChallengeStore(new InMemoryStateStore(), clock, Duration.ofMinutes(10));
    }

    @Test
    void entryLivesForTheTtl() {
        store.put(TestChallenges.challenge("c-1", 0.01), 7, null);

        clock.advance(Duration.ofMinutes(9));
        assertTrue(store.get("c-1").isPresent());

        clock.advance(Duration.ofMinutes(2));
        assertTrue(store.get("c-1").isEmpty());
        assertTrue(store.all().isEmpty());
    }

    @Test
    void putReplacesExistingEntry() {
        store.put(TestChallenges.challenge("c-1", 0.01), 7, null);
        store.put(TestChallenges.challenge("c-1", 0.01), 7, 42);

        assertEquals(1, store.all().size());
        PendingChallenge entry = store.get("c-1").orElseThrow();
        assertEquals(Integer.valueOf(7), entry.tabId);
        assertEquals(Integer.valueOf(42), entry.windowId);
        assertEquals("c-1", entry.challenge.challengeId());
    }

    @Test
    void pruneDropsOnlyExpiredEntries() {
        store.put(TestChallenges.challenge("old", 0.01), null, null);
        clock.advance(Duration.ofMinutes(6));
        store.put(TestChallenges.challenge("new", 0.01), null, null);
        clock.advance(Duration.ofMinutes(5));

        assertEquals(1, store.pruneExpired());
        assertTrue(store.get("new").isPresent());
        assertTrue(store.get("old").isEmpty());
    }

    @Test
    void removeReportsWhetherAnEntryExisted() {
        store.put(TestChallenges.challenge("c-1", 0.01), null, null);

        assertTrue(store.remove("c-1"));
        assertFalse(store.remove("c-1"));
    }
}
