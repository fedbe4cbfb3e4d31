package io.x402.autopay.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** The single persisted state document. */
public class AgentState {
    public AgentSettings settings = new AgentSettings();
    public WalletRecord wallet;
    /** Keyed by {@link ChainId#key()}. */
    public Map<String, BalanceCache> balances = new LinkedHashMap<>();
    public Map<String, SitePolicy> policies = new LinkedHashMap<>();
    /** Newest first. */
    public List<PaymentRecord> history = new ArrayList<>();
    public Map<String, TokenCacheEntry> tokenCache = new LinkedHashMap<>();
    public Map<String, PendingChallenge> pendingChallenges = new LinkedHashMap<>();
    public AgentStatus status = AgentStatus.IDLE;

    /** Default constructor for Jackson. */
    public AgentState() {}

    public static AgentState initial() {
        AgentState state = new AgentState();
        for (ChainId chain : ChainId.values()) {
            state.balances.put(chain.key(), BalanceCache.empty(chain));
        }
        return state;
    }

    /** Fills in members an older or hand-edited document may lack. */
    public AgentState normalize() {
        if (settings == null) {
            settings = new AgentSettings();
        }
        if (balances == null) {
            balances = new LinkedHashMap<>();
        }
        for (ChainId chain : ChainId.values()) {
            balances.putIfAbsent(chain.key(), BalanceCache.empty(chain));
        }
        if (policies == null) {
            policies = new LinkedHashMap<>();
        }
        if (history == null) {
            history = new ArrayList<>();
        }
        if (tokenCache == null) {
            tokenCache = new LinkedHashMap<>();
        }
        if (pendingChallenges == null) {
            pendingChallenges = new LinkedHashMap<>();
        }
        if (status == null) {
            status = AgentStatus.IDLE;
        }
        if (wallet != null) {
            wallet.lockedUntil = 0;
        }
        return this;
    }
}
