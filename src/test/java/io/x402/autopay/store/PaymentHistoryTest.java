package io.x402.autopay.store;

import io.x402.autopay.TestChallenges;
import io.x402.autopay.model.PaymentRecord;
import io.x402.autopay.model.PaymentStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PaymentHistoryTest {

    private PaymentHistory history;

    @BeforeEach
    void setUp() {
        history = new PaymentHistory(new InMemoryStateStore(), 3);
    }

    private static PaymentRecord record(String id, long timestamp) {
        return PaymentRecord.forChallenge(TestChallenges.challenge(id, 0.01), PaymentStatus.PENDING, true, timestamp);
    }

    @Test
    void keepsNewestFirstWithinTheLimit() {
        for (int i = 1; i <= 5; i++) {
            history.add(record("p-" + i, i));
        }

        List<PaymentRecord> records = history.list();
        assertEquals(3, records.size());
        assertEquals("p-5", records.get(0).id);
        assertEquals("p-3", records.get(2).id);
    }

    @Test
    void markSettlementKeepsFieldsThatAreNotGiven() {
        history.add(record("p-1", 1));

        assertTrue(history.markSettlement("p-1", null, null, "facilitator queued"));
        assertTrue(history.markSettlement("p-1", PaymentStatus.SUCCESS, "0xabc", null));

        PaymentRecord updated = history.list().get(0);
        assertEquals(PaymentStatus.SUCCESS, updated.status);
        assertEquals("0xabc", updated.txReference);
        assertEquals("facilitator queued", updated.note);
    }

    @Test
    void settledRecordIsFinal() {
        history.add(record("p-1", 1));
        assertTrue(history.markSettlement("p-1", PaymentStatus.SUCCESS, "0xabc", null));

        assertFalse(history.markSettlement("p-1", PaymentStatus.ERROR, null, "late failure"));

        PaymentRecord record = history.list().get(0);
        assertEquals(PaymentStatus.SUCCESS, record.status);
        assertNull(record.note);
    }

    @Test
    void deniedRecordCannotBeSettled() {
        history.add(PaymentRecord.forChallenge(TestChallenges.challenge("p-1", 0.01), PaymentStatus.DENIED, false, 1));

        assertFalse(history.markSettlement("p-1", PaymentStatus.SUCCESS, "0xdead", null));
        assertEquals(PaymentStatus.DENIED, history.list().get(0).status);
        assertNull(history.list().get(0).txReference);
    }

    @Test
    void markSettlementOfUnknownIdChangesNothing() {
        history.add(record("p-1", 1));

        assertFalse(history.markSettlement("missing", PaymentStatus.ERROR, null, null));
        assertEquals(PaymentStatus.PENDING, history.list().get(0).status);
    }

    @Test
    void clearEmptiesHistory() {
        history.add(record("p-1", 1));

        assertTrue(history.clear().isEmpty());
        assertTrue(history.list().isEmpty());
    }
}
