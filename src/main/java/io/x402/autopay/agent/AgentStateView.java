package io.x402.autopay.agent;

import io.x402.autopay.model.AgentSettings;
import io.x402.autopay.model.AgentState;
import io.x402.autopay.model.AgentStatus;
import io.x402.autopay.model.BalanceCache;
import io.x402.autopay.model.PaymentRecord;
import io.x402.autopay.model.PendingChallenge;
import io.x402.autopay.model.SitePolicy;
import io.x402.autopay.wallet.WalletView;

import java.util.List;
import java.util.Map;

/** Snapshot of the agent state for UI collaborators, with the wallet redacted. */
public record AgentStateView(
    AgentSettings settings,
    WalletView wallet,
    Map<String, BalanceCache> balances,
    Map<String, SitePolicy> policies,
    List<PaymentRecord> history,
    Map<String, PendingChallenge> pendingChallenges,
    AgentStatus status) {

    static AgentStateView of(AgentState state, WalletView wallet) {
        return new AgentStateView(state.settings, wallet, state.balances, state.policies, state.history,
            state.pendingChallenges, state.status);
    }
}
