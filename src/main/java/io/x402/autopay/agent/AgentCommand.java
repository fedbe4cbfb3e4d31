package io.x402.autopay.agent;

import io.x402.autopay.model.AgentSettings;
import io.x402.autopay.model.BalanceCache;
import io.x402.autopay.model.ChainId;
import io.x402.autopay.model.ChallengeDetails;
import io.x402.autopay.model.PaymentRecord;
import io.x402.autopay.model.SitePolicy;
import io.x402.autopay.model.TokenCacheEntry;
import io.x402.autopay.settlement.SettlementNotice;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Requests the interception side and UI collaborators send to the {@link PaymentAgent}.
 *
 * @param <R> reply type
 */
public sealed interface AgentCommand<R> {

    R dispatch(CommandHandler handler);

    /** A 402 challenge the interceptor parsed. */
    record SubmitChallenge(ChallengeDetails challenge, Integer tabId) implements AgentCommand<ChallengeResolution> {
        public SubmitChallenge {
            Objects.requireNonNull(challenge, "challenge");
        }

        @Override
        public ChallengeResolution dispatch(CommandHandler handler) {
            return handler.submitChallenge(this);
        }
    }

    record GetPendingChallenge(String challengeId) implements AgentCommand<PendingReply> {
        @Override
        public PendingReply dispatch(CommandHandler handler) {
            return handler.getPendingChallenge(this);
        }
    }

    record ResolvePendingChallenge(String challengeId, PromptDecision decision) implements AgentCommand<DecisionResult> {
        public ResolvePendingChallenge {
            Objects.requireNonNull(decision, "decision");
        }

        @Override
        public DecisionResult dispatch(CommandHandler handler) {
            return handler.resolvePendingChallenge(this);
        }
    }

    record GetState() implements AgentCommand<AgentStateView> {
        @Override
        public AgentStateView dispatch(CommandHandler handler) {
            return handler.getState(this);
        }
    }

    /**
     * @param lockMinutes unlock duration; null selects the default
     */
    record ConfigureWallet(String secret, String passphrase, Integer lockMinutes, String label)
        implements AgentCommand<WalletReply> {
        @Override
        public WalletReply dispatch(CommandHandler handler) {
            return handler.configureWallet(this);
        }

        @Override
        public String toString() {
            return "ConfigureWallet{lockMinutes=" + lockMinutes + ", label=" + label + "}";
        }
    }

    /**
     * @param lockMinutes unlock duration; null keeps the stored one
     */
    record UnlockWallet(String passphrase, Integer lockMinutes) implements AgentCommand<WalletReply> {
        @Override
        public WalletReply dispatch(CommandHandler handler) {
            return handler.unlockWallet(this);
        }

        @Override
        public String toString() {
            return "UnlockWallet{lockMinutes=" + lockMinutes + "}";
        }
    }

    record LockWallet() implements AgentCommand<WalletReply> {
        @Override
        public WalletReply dispatch(CommandHandler handler) {
            return handler.lockWallet(this);
        }
    }

    record RemoveWallet() implements AgentCommand<WalletReply> {
        @Override
        public WalletReply dispatch(CommandHandler handler) {
            return handler.removeWallet(this);
        }
    }

    record ExportWallet(String passphrase) implements AgentCommand<ExportReply> {
        @Override
        public ExportReply dispatch(CommandHandler handler) {
            return handler.exportWallet(this);
        }

        @Override
        public String toString() {
            return "ExportWallet{}";
        }
    }

    record UpdateSettings(SettingsUpdate update) implements AgentCommand<AgentSettings> {
        @Override
        public AgentSettings dispatch(CommandHandler handler) {
            return handler.updateSettings(this);
        }
    }

    record UpdatePolicy(String origin, PolicyUpdate update) implements AgentCommand<Map<String, SitePolicy>> {
        public UpdatePolicy {
            Objects.requireNonNull(origin, "origin");
            Objects.requireNonNull(update, "update");
        }

        @Override
        public Map<String, SitePolicy> dispatch(CommandHandler handler) {
            return handler.updatePolicy(this);
        }
    }

    record RemovePolicy(String origin) implements AgentCommand<Map<String, SitePolicy>> {
        @Override
        public Map<String, SitePolicy> dispatch(CommandHandler handler) {
            return handler.removePolicy(this);
        }
    }

    record ResetPolicies() implements AgentCommand<Map<String, SitePolicy>> {
        @Override
        public Map<String, SitePolicy> dispatch(CommandHandler handler) {
            return handler.resetPolicies(this);
        }
    }

    record ClearHistory() implements AgentCommand<List<PaymentRecord>> {
        @Override
        public List<PaymentRecord> dispatch(CommandHandler handler) {
            return handler.clearHistory(this);
        }
    }

    /** An already decoded settlement outcome. */
    record ReportSettlement(SettlementNotice notice) implements AgentCommand<Boolean> {
        @Override
        public Boolean dispatch(CommandHandler handler) {
            return handler.reportSettlement(this);
        }
    }

    /** A raw X-PAYMENT-RESPONSE value, decoded by the agent. */
    record ReconcileSettlement(String paymentId, String headerValue) implements AgentCommand<Boolean> {
        @Override
        public Boolean dispatch(CommandHandler handler) {
            return handler.reconcileSettlement(this);
        }
    }

    /** Reply is null when no live token exists for the payment. */
    record GetSettlementToken(String paymentId) implements AgentCommand<TokenCacheEntry> {
        @Override
        public TokenCacheEntry dispatch(CommandHandler handler) {
            return handler.getSettlementToken(this);
        }
    }

    /**
     * @param chain null refreshes every supported chain
     * @param force ignore the refresh interval
     */
    record RefreshBalances(ChainId chain, boolean force) implements AgentCommand<Map<ChainId, BalanceCache>> {
        @Override
        public Map<ChainId, BalanceCache> dispatch(CommandHandler handler) {
            return handler.refreshBalances(this);
        }
    }
}
