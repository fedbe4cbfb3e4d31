package io.x402.autopay.store;

import io.x402.autopay.model.AgentState;
import io.x402.autopay.model.ChallengeDetails;
import io.x402.autopay.model.PendingChallenge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Challenges waiting for a decision, keyed by challenge id. Entries older than the TTL are
 * pruned before every read, so no caller sees a stale challenge.
 */
public class PendingChallengeStore {

    private static final Logger LOG = LoggerFactory.getLogger(PendingChallengeStore.class);

    private final StateStore stateStore;
    private final Clock clock;
    private final Duration ttl;

    public PendingChallengeStore(StateStore stateStore, Clock clock, Duration ttl) {
        this.stateStore = stateStore;
        this.clock = clock;
        this.ttl = ttl;
    }

    /** Stores or replaces the entry for the challenge's id. */
    public PendingChallenge put(ChallengeDetails challenge, Integer tabId, Integer windowId) {
        PendingChallenge entry = new PendingChallenge(challenge, tabId, windowId, clock.millis());
        stateStore.update(state -> {
            prune(state, clock.millis());
            state.pendingChallenges.put(challenge.challengeId(), entry);
        });
        return entry;
    }

    public Optional<PendingChallenge> get(String challengeId) {
        return Optional.ofNullable(all().get(challengeId));
    }

    /** Live entries after pruning. */
    public Map<String, PendingChallenge> all() {
        pruneExpired();
        return stateStore.read().pendingChallenges;
    }

    public boolean remove(String challengeId) {
        boolean[] removed = new boolean[1];
        stateStore.update(state -> removed[0] = state.pendingChallenges.remove(challengeId) != null);
        return removed[0];
    }

    /** @return number of entries dropped */
    public int pruneExpired() {
        AgentState snapshot = stateStore.read();
        long now = clock.millis();
        if (!hasExpired(snapshot, now)) {
            return 0;
        }
        int[] pruned = new int[1];
        stateStore.update(state -> pruned[0] = prune(state, now));
        if (pruned[0] > 0) {
            LOG.debug("Pruned {} expired pending challenge(s)", pruned[0]);
        }
        return pruned[0];
    }

    private boolean hasExpired(AgentState state, long now) {
        for (PendingChallenge entry : state.pendingChallenges.values()) {
            if (isExpired(entry, now)) {
                return true;
            }
        }
        return false;
    }

    private int prune(AgentState state, long now) {
        int count = 0;
        Iterator<PendingChallenge> entries = state.pendingChallenges.values().iterator();
        while (entries.hasNext()) {
            if (isExpired(entries.next(), now)) {
                entries.remove();
                count++;
            }
        }
        return count;
    }

    private boolean isExpired(PendingChallenge entry, long now) {
        return entry.createdAt > 0 && now - entry.createdAt > ttl.toMillis();
    }
}
