package io.x402.autopay.settlement;

import io.x402.autopay.model.AgentStatus;
import io.x402.autopay.store.PaymentHistory;
import io.x402.autopay.store.PendingChallengeStore;
import io.x402.autopay.store.SettlementTokenCache;
import io.x402.autopay.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Applies settlement outcomes to the payment history: updates the record, caches the access
 * token, clears the pending challenge and marks the agent verified.
 */
public class SettlementReconciler {

    private static final Logger LOG = LoggerFactory.getLogger(SettlementReconciler.class);

    private final StateStore stateStore;
    private final PaymentHistory history;
    private final SettlementTokenCache tokenCache;
    private final PendingChallengeStore pendingChallenges;
    private final SettlementDecoder decoder;

    public SettlementReconciler(StateStore stateStore, PaymentHistory history, SettlementTokenCache tokenCache,
                                PendingChallengeStore pendingChallenges) {
        this(stateStore, history, tokenCache, pendingChallenges, new SettlementDecoder());
    }

    SettlementReconciler(StateStore stateStore, PaymentHistory history, SettlementTokenCache tokenCache,
                         PendingChallengeStore pendingChallenges, SettlementDecoder decoder) {
        this.stateStore = stateStore;
        this.history = history;
        this.tokenCache = tokenCache;
        this.pendingChallenges = pendingChallenges;
        this.decoder = decoder;
    }

    /**
     * Decodes a settlement header and applies it. An undecodable header leaves the payment
     * record as it was.
     *
     * @param paymentId   id sent in X-PAYMENT-ID, or null to use the id echoed in the header
     * @param headerValue X-PAYMENT-RESPONSE value
     * @return the notice that was applied, or empty when nothing could be reconciled
     */
    public Optional<SettlementNotice> reconcile(String paymentId, String headerValue) {
        Optional<SettlementReceipt> receipt = decoder.decode(headerValue);
        if (receipt.isEmpty()) {
            LOG.debug("Settlement for {} left pending: header could not be decoded", paymentId);
            return Optional.empty();
        }
        SettlementNotice notice = SettlementNotice.of(paymentId, receipt.get());
        return apply(notice) ? Optional.of(notice) : Optional.empty();
    }

    /**
     * Settles the pending record for the notice's payment. Unknown payments and records that
     * were already settled or denied are left alone.
     *
     * @return false when nothing was applied
     */
    public boolean apply(SettlementNotice notice) {
        if (notice == null || notice.paymentId() == null || notice.paymentId().isBlank()) {
            return false;
        }
        String paymentId = notice.paymentId();
        boolean known = history.markSettlement(paymentId, notice.resolvedStatus(), notice.txReference(), notice.message());
        if (!known) {
            LOG.warn("Ignoring settlement for {}: no pending payment with that id", paymentId);
            return false;
        }
        if (notice.token() != null && !notice.token().isBlank()) {
            tokenCache.save(paymentId, notice.token());
        }
        pendingChallenges.remove(paymentId);
        stateStore.update(state -> state.status = AgentStatus.VERIFIED);
        LOG.info("Payment {} settled: {} tx={}", paymentId, notice.resolvedStatus().wireName(), notice.txReference());
        return true;
    }
}
