package io.x402.autopay.settlement;

import io.x402.autopay.MutableClock;
import io.x402.autopay.model.AgentStatus;
import io.x402.autopay.model.PaymentRecord;
import io.x402.autopay.model.PaymentStatus;
import io.x402.autopay.store.InMemoryStateStore;
import io.x402.autopay.store.PaymentHistory;
import io.x402.autopay.store.PendingChallengeStore;
import io.x402.autopay.store.SettlementTokenCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static io.x402.autopay.TestChallenges.challenge;
import static org.junit.jupiter.api.Assertions.*;

class SettlementReconcilerTest {

    private InMemoryStateStore store;
    private PaymentHistory history;
    private SettlementTokenCache tokens;
    private PendingChallengeStore pending;
    private SettlementReconciler reconciler;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at("2025-03-01T12:00:00Z");
        store = new InMemoryStateStore();
        history = new PaymentHistory(store, 50);
        tokens = new SettlementTokenCache(store, clock, Duration.ofMinutes(5));
        pending = new PendingChallengeStore(store, clock, Duration.ofMinutes(5));
        reconciler = new SettlementReconciler(store, history, tokens, pending);

        history.add(PaymentRecord.forChallenge(challenge("p-1", 0.01), PaymentStatus.PENDING, true, 1L));
        pending.put(challenge("p-1", 0.01), null, null);
    }

    private PaymentRecord record() {
        return history.list().get(0);
    }

    @Test
    void transactionReferenceMeansSuccess() {
        Optional<SettlementNotice> notice = reconciler.reconcile("p-1",
            "{\"transaction\":\"0xabc\",\"jwt\":\"h.p.s\"}");

        assertTrue(notice.isPresent());
        assertEquals(PaymentStatus.SUCCESS, record().status);
        assertEquals("0xabc", record().txReference);
        assertEquals("h.p.s", tokens.get("p-1").orElseThrow().token);
        assertTrue(pending.get("p-1").isEmpty());
        assertEquals(AgentStatus.VERIFIED, store.read().status);
    }

    @Test
    void missingTransactionReferenceMeansError() {
        reconciler.reconcile("p-1", "{\"network\":\"polygon-amoy\"}");

        assertEquals(PaymentStatus.ERROR, record().status);
        assertNull(record().txReference);
    }

    @Test
    void explicitFailureWinsOverTransactionReference() {
        reconciler.reconcile("p-1", "{\"success\":false,\"transaction\":\"0xabc\",\"errorReason\":\"insufficient_funds\"}");

        assertEquals(PaymentStatus.ERROR, record().status);
        assertEquals("insufficient_funds", record().note);
    }

    @Test
    void explicitStatusOnNoticeWins() {
        assertTrue(reconciler.apply(new SettlementNotice("p-1", null, null, null, PaymentStatus.SUCCESS, null)));

        assertEquals(PaymentStatus.SUCCESS, record().status);
    }

    @Test
    void paymentIdFallsBackToTheEchoedId() {
        reconciler.reconcile(null, "{\"transaction\":\"0xabc\",\"paymentId\":\"p-1\"}");

        assertEquals(PaymentStatus.SUCCESS, record().status);
    }

    @Test
    void tokenOnlyHeaderCachesTokenAndRecordsError() {
        reconciler.reconcile("p-1", "h.p.s");

        assertEquals("h.p.s", tokens.get("p-1").orElseThrow().token);
        assertEquals(PaymentStatus.ERROR, record().status);
    }

    @Test
    void undecodableHeaderLeavesRecordPending() {
        Optional<SettlementNotice> notice = reconciler.reconcile("p-1", "garbage value");

        assertTrue(notice.isEmpty());
        assertEquals(PaymentStatus.PENDING, record().status);
        assertTrue(pending.get("p-1").isPresent());
        assertEquals(AgentStatus.IDLE, store.read().status);
    }

    @Test
    void secondSettlementCannotUndoTheFirst() {
        reconciler.reconcile("p-1", "{\"transaction\":\"0xabc\"}");

        Optional<SettlementNotice> late = reconciler.reconcile("p-1", "{\"success\":false,\"jwt\":\"x.y.z\"}");

        assertTrue(late.isEmpty());
        assertEquals(PaymentStatus.SUCCESS, record().status);
        assertEquals("0xabc", record().txReference);
        assertTrue(tokens.get("p-1").isEmpty());
    }

    @Test
    void settlementForUnknownPaymentIsIgnored() {
        assertFalse(reconciler.apply(new SettlementNotice("other", "0xabc", null, "a.b.c", null, null)));

        assertTrue(tokens.get("other").isEmpty());
        assertEquals(AgentStatus.IDLE, store.read().status);
    }

    @Test
    void noticeWithoutPaymentIdIsIgnored() {
        assertFalse(reconciler.apply(new SettlementNotice(null, "0xabc", null, null, null, null)));
        assertEquals(PaymentStatus.PENDING, record().status);
    }
}
