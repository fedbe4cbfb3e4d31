package io.x402.autopay.store;

import io.x402.autopay.model.TokenCacheEntry;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/** Short-lived access tokens returned with settlements, keyed by payment id. */
public class SettlementTokenCache {

    private final StateStore stateStore;
    private final Clock clock;
    private final Duration ttl;

    public SettlementTokenCache(StateStore stateStore, Clock clock, Duration ttl) {
        this.stateStore = stateStore;
        this.clock = clock;
        this.ttl = ttl;
    }

    public TokenCacheEntry save(String paymentId, String token) {
        TokenCacheEntry entry = new TokenCacheEntry(paymentId, token, clock.millis() + ttl.toMillis());
        stateStore.update(state -> state.tokenCache.put(paymentId, entry));
        return entry;
    }

    public Optional<TokenCacheEntry> get(String paymentId) {
        TokenCacheEntry entry = stateStore.read().tokenCache.get(paymentId);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiresAt < clock.millis()) {
            prune();
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    /** Drops every expired entry. */
    public void prune() {
        long now = clock.millis();
        stateStore.update(state -> state.tokenCache.values().removeIf(entry -> entry.expiresAt <= now));
    }
}
