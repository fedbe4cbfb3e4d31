package io.x402.autopay.agent;

import io.x402.autopay.authorization.AuthorizationBuilder;
import io.x402.autopay.authorization.SignedAuthorization;
import io.x402.autopay.config.AgentConfig;
import io.x402.autopay.crypto.SigningFailureException;
import io.x402.autopay.model.AgentSettings;
import io.x402.autopay.model.AgentState;
import io.x402.autopay.model.AgentStatus;
import io.x402.autopay.model.BalanceCache;
import io.x402.autopay.model.ChainId;
import io.x402.autopay.model.ChallengeDetails;
import io.x402.autopay.model.PaymentRecord;
import io.x402.autopay.model.PaymentStatus;
import io.x402.autopay.model.PendingChallenge;
import io.x402.autopay.model.SitePolicy;
import io.x402.autopay.model.TokenCacheEntry;
import io.x402.autopay.model.WalletRecord;
import io.x402.autopay.policy.PolicyEngine;
import io.x402.autopay.policy.PolicyVerdict;
import io.x402.autopay.policy.SpendLedger;
import io.x402.autopay.settlement.SettlementReconciler;
import io.x402.autopay.store.InMemoryStateStore;
import io.x402.autopay.store.JsonFileStateStore;
import io.x402.autopay.store.PaymentHistory;
import io.x402.autopay.store.PendingChallengeStore;
import io.x402.autopay.store.SettlementTokenCache;
import io.x402.autopay.store.StateStore;
import io.x402.autopay.wallet.IncorrectPassphraseException;
import io.x402.autopay.wallet.InvalidSecretException;
import io.x402.autopay.wallet.WalletLockedException;
import io.x402.autopay.wallet.WalletNotConfiguredException;
import io.x402.autopay.wallet.WalletSession;
import io.x402.autopay.wallet.WalletVault;
import io.x402.autopay.wallet.WalletView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Orchestrates payments: owns the wallet, the state document and the policy decision.
 * Commands are expected on a single thread; {@link AgentBus} provides one.
 */
public class PaymentAgent implements CommandHandler {

    private static final Logger LOG = LoggerFactory.getLogger(PaymentAgent.class);

    static final String AUTO_PAYMENT_FAILED = "Auto payment failed";
    static final String CHALLENGE_NOT_FOUND = "Challenge not found";
    static final String PASSPHRASE_REQUIRED = "Passphrase required";

    private final AgentConfig config;
    private final Clock clock;
    private final StateStore stateStore;
    private final WalletVault vault;
    private final PolicyEngine policyEngine;
    private final AuthorizationBuilder authorizationBuilder;
    private final PendingChallengeStore pendingChallenges;
    private final PaymentHistory history;
    private final SettlementTokenCache tokenCache;
    private final SettlementReconciler reconciler;
    private final ApprovalPrompt approvalPrompt;
    private final BalanceProvider balanceProvider;
    private final List<ResolutionListener> listeners = new CopyOnWriteArrayList<>();

    public PaymentAgent(StateStore stateStore, AgentConfig config, ApprovalPrompt approvalPrompt,
                        BalanceProvider balanceProvider) {
        this(stateStore, config, new WalletVault(stateStore, config), new AuthorizationBuilder(config.getClock()),
            approvalPrompt, balanceProvider);
    }

    PaymentAgent(StateStore stateStore, AgentConfig config, WalletVault vault, AuthorizationBuilder authorizationBuilder,
                 ApprovalPrompt approvalPrompt, BalanceProvider balanceProvider) {
        this.config = config;
        this.clock = config.getClock();
        this.stateStore = stateStore;
        this.vault = vault;
        this.authorizationBuilder = authorizationBuilder;
        this.policyEngine = new PolicyEngine(clock);
        this.pendingChallenges = new PendingChallengeStore(stateStore, clock, config.getPendingChallengeTtl());
        this.history = new PaymentHistory(stateStore, config.getHistoryLimit());
        this.tokenCache = new SettlementTokenCache(stateStore, clock, config.getSettlementTokenTtl());
        this.reconciler = new SettlementReconciler(stateStore, history, tokenCache, pendingChallenges);
        this.approvalPrompt = approvalPrompt != null ? approvalPrompt : ApprovalPrompt.NONE;
        this.balanceProvider = balanceProvider;
    }

    /**
     * Agent backed by the configured state file, or by memory when none is configured.
     *
     * @param balanceProvider null disables balance refresh
     * @throws IOException when the state file's directory cannot be created
     */
    public static PaymentAgent create(AgentConfig config, ApprovalPrompt approvalPrompt, BalanceProvider balanceProvider)
        throws IOException {
        StateStore store = config.getStateFile() != null
            ? new JsonFileStateStore(config.getStateFile())
            : new InMemoryStateStore();
        return new PaymentAgent(store, config, approvalPrompt, balanceProvider);
    }

    public void addResolutionListener(ResolutionListener listener) {
        listeners.add(listener);
    }

    public void removeResolutionListener(ResolutionListener listener) {
        listeners.remove(listener);
    }

    public AgentConfig getConfig() {
        return config;
    }

    boolean hasBalanceProvider() {
        return balanceProvider != null;
    }

    // ---------------------------------------------------------------------
    // challenges
    // ---------------------------------------------------------------------

    @Override
    public ChallengeResolution submitChallenge(AgentCommand.SubmitChallenge command) {
        ChallengeDetails challenge = command.challenge();
        AgentState state = stateStore.read();
        AgentSettings settings = switchChain(state.settings, challenge);
        refreshChallengeBalance(state, challenge);
        pendingChallenges.put(challenge, command.tabId(), null);

        PolicyVerdict verdict = policyEngine.decide(settings, state.policies.get(challenge.origin()), state.history, challenge);
        LOG.info("Challenge {} from {} for {} USD: {}", challenge.challengeId(), challenge.origin(),
            challenge.amountUsd(), verdict);

        if (verdict.isApproved()) {
            try {
                return payWithStatus(challenge, true);
            } catch (WalletLockedException e) {
                LOG.info("Auto-approval of {} blocked by locked wallet", challenge.challengeId());
            }
        }
        return prompt(challenge, command.tabId());
    }

    @Override
    public PendingReply getPendingChallenge(AgentCommand.GetPendingChallenge command) {
        return new PendingReply(pendingChallenges.get(command.challengeId()).orElse(null));
    }

    @Override
    public DecisionResult resolvePendingChallenge(AgentCommand.ResolvePendingChallenge command) {
        String challengeId = command.challengeId();
        PromptDecision decision = command.decision();
        Optional<PendingChallenge> entry = challengeId == null ? Optional.empty() : pendingChallenges.get(challengeId);
        if (entry.isEmpty()) {
            return DecisionResult.error(CHALLENGE_NOT_FOUND);
        }
        ChallengeDetails challenge = entry.get().challenge;
        Integer windowId = entry.get().windowId;
        LOG.info("Prompt decision for {}: approve={} alwaysAllow={}", challengeId, decision.approve(), decision.alwaysAllow());

        if (!decision.approve()) {
            recordPayment(PaymentRecord.forChallenge(challenge, PaymentStatus.DENIED, false, clock.millis()));
            setStatus(AgentStatus.IDLE);
            pendingChallenges.remove(challengeId);
            broadcast(challengeId, ChallengeResolution.deny(challengeId));
            closePrompt(windowId);
            return DecisionResult.denied();
        }

        ChallengeResolution resolution;
        try {
            resolution = payWithStatus(challenge, false);
        } catch (WalletLockedException e) {
            LOG.info("Approval of {} needs an unlocked wallet", challengeId);
            return DecisionResult.locked();
        }
        broadcast(challengeId, resolution);
        pendingChallenges.remove(challengeId);
        closePrompt(windowId);
        if (resolution.action() == ChallengeResolution.Action.ERROR) {
            return DecisionResult.error(resolution.message());
        }
        if (decision.alwaysAllow()) {
            LocalDate today = today();
            stateStore.update(state -> state.policies
                .computeIfAbsent(challenge.origin(), origin -> SitePolicy.createDefault(origin, today))
                .allowUnderThreshold = true);
        }
        return DecisionResult.success();
    }

    private AgentSettings switchChain(AgentSettings settings, ChallengeDetails challenge) {
        Optional<ChainId> mapped = ChainId.fromChainId(challenge.chainId());
        if (mapped.isEmpty() || mapped.get() == settings.chain) {
            return settings;
        }
        ChainId chain = mapped.get();
        LOG.info("Switching active chain to {} for challenge {}", chain.key(), challenge.challengeId());
        return stateStore.update(state -> state.settings.chain = chain).settings;
    }

    /** The payer is about to look at this chain, so its balance is fetched regardless of age. */
    private void refreshChallengeBalance(AgentState state, ChallengeDetails challenge) {
        Optional<ChainId> mapped = ChainId.fromChainId(challenge.chainId());
        if (balanceProvider == null || state.wallet == null || mapped.isEmpty()) {
            return;
        }
        refreshBalance(stateStore.read(), state.wallet.address, mapped.get(), true);
    }

    private ChallengeResolution prompt(ChallengeDetails challenge, Integer tabId) {
        try {
            Integer windowId = approvalPrompt.open(challenge);
            if (windowId != null) {
                pendingChallenges.put(challenge, tabId, windowId);
            }
        } catch (RuntimeException e) {
            LOG.error("Failed to open approval prompt for {}", challenge.challengeId(), e);
        }
        return ChallengeResolution.pending(challenge.challengeId());
    }

    private void closePrompt(Integer windowId) {
        if (windowId == null) {
            return;
        }
        try {
            approvalPrompt.close(windowId);
        } catch (RuntimeException e) {
            LOG.warn("Failed to close approval prompt {}", windowId, e);
        }
    }

    private void broadcast(String challengeId, ChallengeResolution resolution) {
        for (ResolutionListener listener : listeners) {
            try {
                listener.onResolution(challengeId, resolution);
            } catch (RuntimeException e) {
                LOG.warn("Resolution listener failed for {}", challengeId, e);
            }
        }
    }

    // ---------------------------------------------------------------------
    // payment
    // ---------------------------------------------------------------------

    private ChallengeResolution payWithStatus(ChallengeDetails challenge, boolean autoApproved)
        throws WalletLockedException {
        setStatus(AgentStatus.PAYING);
        try {
            return processPayment(challenge, autoApproved);
        } finally {
            stateStore.update(state -> {
                if (state.status == AgentStatus.PAYING) {
                    state.status = AgentStatus.IDLE;
                }
            });
        }
    }

    /**
     * Signs the challenge and records it as pending.
     *
     * @throws WalletLockedException when no session is active; nothing is recorded
     */
    private ChallengeResolution processPayment(ChallengeDetails challenge, boolean autoApproved)
        throws WalletLockedException {
        AgentState state = stateStore.read();
        if (state.wallet == null) {
            LOG.warn("Cannot pay {}: wallet not configured", challenge.challengeId());
            return ChallengeResolution.error("Wallet not configured");
        }
        WalletSession session = vault.requireSession();
        try {
            SignedAuthorization signed = authorizationBuilder.build(session, state.settings, challenge);
            recordPayment(PaymentRecord.forChallenge(challenge, PaymentStatus.PENDING, autoApproved, clock.millis()));
            recordSpend(challenge.origin(), challenge.amountUsd());
            vault.renew();
            LOG.info("Signed payment {} ({} atomic to {})", signed.paymentId(), challenge.amountAtomic(), challenge.seller());
            return ChallengeResolution.retry(signed.headerValue(), signed.paymentId());
        } catch (SigningFailureException | RuntimeException e) {
            PaymentRecord failed = PaymentRecord.forChallenge(challenge, PaymentStatus.ERROR, autoApproved, clock.millis());
            failed.note = e.getMessage();
            recordPayment(failed);
            vault.renew();
            LOG.error("Payment {} failed", challenge.challengeId(), e);
            return ChallengeResolution.error(AUTO_PAYMENT_FAILED);
        }
    }

    private void recordPayment(PaymentRecord record) {
        history.add(record);
        tokenCache.prune();
    }

    private void recordSpend(String origin, double amountUsd) {
        LocalDate today = today();
        stateStore.update(state -> {
            SitePolicy policy = state.policies.computeIfAbsent(origin, key -> SitePolicy.createDefault(key, today));
            SpendLedger.recordSpend(policy, amountUsd, today);
        });
    }

    private void setStatus(AgentStatus status) {
        stateStore.update(state -> state.status = status);
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    // ---------------------------------------------------------------------
    // state and wallet
    // ---------------------------------------------------------------------

    @Override
    public AgentStateView getState(AgentCommand.GetState command) {
        AgentState state = stateStore.read();
        return AgentStateView.of(state, vault.view(state.wallet));
    }

    @Override
    public WalletReply configureWallet(AgentCommand.ConfigureWallet command) {
        try {
            return WalletReply.of(vault.configure(command.secret(), command.passphrase(), command.lockMinutes(),
                command.label()));
        } catch (InvalidSecretException | IllegalArgumentException e) {
            LOG.warn("Wallet configuration rejected: {}", e.getMessage());
            return WalletReply.failure(e.getMessage());
        }
    }

    @Override
    public WalletReply unlockWallet(AgentCommand.UnlockWallet command) {
        if (command.passphrase() == null || command.passphrase().isEmpty()) {
            return WalletReply.failure(PASSPHRASE_REQUIRED);
        }
        try {
            return WalletReply.of(vault.unlock(command.passphrase(), command.lockMinutes()));
        } catch (WalletNotConfiguredException | IncorrectPassphraseException e) {
            LOG.warn("Unlock failed: {}", e.getMessage());
            return WalletReply.failure(e.getMessage());
        }
    }

    @Override
    public WalletReply lockWallet(AgentCommand.LockWallet command) {
        WalletView view = vault.lock();
        return new WalletReply(view, true, null);
    }

    @Override
    public WalletReply removeWallet(AgentCommand.RemoveWallet command) {
        vault.remove();
        return new WalletReply(null, true, null);
    }

    @Override
    public ExportReply exportWallet(AgentCommand.ExportWallet command) {
        if (command.passphrase() == null || command.passphrase().isEmpty()) {
            return ExportReply.failure(PASSPHRASE_REQUIRED);
        }
        try {
            return ExportReply.of(vault.exportSecret(command.passphrase()));
        } catch (WalletNotConfiguredException | IncorrectPassphraseException e) {
            LOG.warn("Export failed: {}", e.getMessage());
            return ExportReply.failure(e.getMessage());
        }
    }

    // ---------------------------------------------------------------------
    // settings, policies, history
    // ---------------------------------------------------------------------

    @Override
    public AgentSettings updateSettings(AgentCommand.UpdateSettings command) {
        SettingsUpdate update = command.update();
        if (update == null) {
            return stateStore.read().settings;
        }
        return stateStore.update(state -> update.applyTo(state.settings)).settings;
    }

    @Override
    public Map<String, SitePolicy> updatePolicy(AgentCommand.UpdatePolicy command) {
        LocalDate today = today();
        return stateStore.update(state -> command.update().applyTo(state.policies
            .computeIfAbsent(command.origin(), origin -> SitePolicy.createDefault(origin, today)))).policies;
    }

    @Override
    public Map<String, SitePolicy> removePolicy(AgentCommand.RemovePolicy command) {
        return stateStore.update(state -> state.policies.remove(command.origin())).policies;
    }

    @Override
    public Map<String, SitePolicy> resetPolicies(AgentCommand.ResetPolicies command) {
        return stateStore.update(state -> state.policies.clear()).policies;
    }

    @Override
    public List<PaymentRecord> clearHistory(AgentCommand.ClearHistory command) {
        return history.clear();
    }

    // ---------------------------------------------------------------------
    // settlement
    // ---------------------------------------------------------------------

    @Override
    public Boolean reportSettlement(AgentCommand.ReportSettlement command) {
        return reconciler.apply(command.notice());
    }

    @Override
    public Boolean reconcileSettlement(AgentCommand.ReconcileSettlement command) {
        return reconciler.reconcile(command.paymentId(), command.headerValue()).isPresent();
    }

    @Override
    public TokenCacheEntry getSettlementToken(AgentCommand.GetSettlementToken command) {
        return tokenCache.get(command.paymentId()).orElse(null);
    }

    // ---------------------------------------------------------------------
    // balances
    // ---------------------------------------------------------------------

    @Override
    public Map<ChainId, BalanceCache> refreshBalances(AgentCommand.RefreshBalances command) {
        AgentState state = stateStore.read();
        WalletRecord wallet = state.wallet;
        if (balanceProvider != null && wallet != null) {
            List<ChainId> targets = command.chain() != null ? List.of(command.chain()) : List.of(ChainId.values());
            for (ChainId chain : targets) {
                refreshBalance(state, wallet.address, chain, command.force());
            }
        } else if (wallet == null) {
            LOG.debug("Balance refresh skipped: wallet not configured");
        }
        Map<ChainId, BalanceCache> balances = new EnumMap<>(ChainId.class);
        for (Map.Entry<String, BalanceCache> entry : stateStore.read().balances.entrySet()) {
            balances.put(ChainId.fromKey(entry.getKey()), entry.getValue());
        }
        return balances;
    }

    private void refreshBalance(AgentState state, String address, ChainId chain, boolean force) {
        long now = clock.millis();
        BalanceCache current = state.balances.get(chain.key());
        if (!force && current != null && current.lastFetched > 0
            && now - current.lastFetched <= config.getBalanceRefreshInterval().toMillis()) {
            return;
        }
        try {
            BalanceCache next = balanceProvider.fetchBalance(chain, address, state.settings.preferredToken);
            next.lastFetched = now;
            stateStore.update(updated -> updated.balances.put(chain.key(), next));
            LOG.info("Balance on {}: {} {} (~{} USD)", chain.key(), next.tokenBalance, next.tokenSymbol, next.usd);
        } catch (IOException e) {
            LOG.warn("Balance refresh failed on {}", chain.key(), e);
        }
    }
}
