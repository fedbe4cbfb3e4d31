package io.x402.autopay.agent;

import io.x402.autopay.model.AgentSettings;
import io.x402.autopay.model.BalanceCache;
import io.x402.autopay.model.ChainId;
import io.x402.autopay.model.PaymentRecord;
import io.x402.autopay.model.SitePolicy;
import io.x402.autopay.model.TokenCacheEntry;

import java.util.List;
import java.util.Map;

/** One method per {@link AgentCommand} variant. */
public interface CommandHandler {

    ChallengeResolution submitChallenge(AgentCommand.SubmitChallenge command);

    PendingReply getPendingChallenge(AgentCommand.GetPendingChallenge command);

    DecisionResult resolvePendingChallenge(AgentCommand.ResolvePendingChallenge command);

    AgentStateView getState(AgentCommand.GetState command);

    WalletReply configureWallet(AgentCommand.ConfigureWallet command);

    WalletReply unlockWallet(AgentCommand.UnlockWallet command);

    WalletReply lockWallet(AgentCommand.LockWallet command);

    WalletReply removeWallet(AgentCommand.RemoveWallet command);

    ExportReply exportWallet(AgentCommand.ExportWallet command);

    AgentSettings updateSettings(AgentCommand.UpdateSettings command);

    Map<String, SitePolicy> updatePolicy(AgentCommand.UpdatePolicy command);

    Map<String, SitePolicy> removePolicy(AgentCommand.RemovePolicy command);

    Map<String, SitePolicy> resetPolicies(AgentCommand.ResetPolicies command);

    List<PaymentRecord> clearHistory(AgentCommand.ClearHistory command);

    Boolean reportSettlement(AgentCommand.ReportSettlement command);

    Boolean reconcileSettlement(AgentCommand.ReconcileSettlement command);

    TokenCacheEntry getSettlementToken(AgentCommand.GetSettlementToken command);

    Map<ChainId, BalanceCache> refreshBalances(AgentCommand.RefreshBalances command);
}
