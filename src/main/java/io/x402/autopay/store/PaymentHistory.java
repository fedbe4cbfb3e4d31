package io.x402.autopay.store;

import io.x402.autopay.model.PaymentRecord;
import io.x402.autopay.model.PaymentStatus;

import java.util.List;

/** Newest-first payment history, bounded to a fixed number of records. */
public class PaymentHistory {

    private final StateStore stateStore;
    private final int limit;

    public PaymentHistory(StateStore stateStore, int limit) {
        this.stateStore = stateStore;
        this.limit = limit;
    }

    public void add(PaymentRecord record) {
        stateStore.update(state -> {
            state.history.add(0, record);
            if (state.history.size() > limit) {
                state.history.subList(limit, state.history.size()).clear();
            }
        });
    }

    /**
     * Applies a settlement outcome to the pending record with the given id. Null arguments keep
     * the record's current value. Records that already reached a final status are never touched.
     *
     * @return false when no pending record has that id
     */
    public boolean markSettlement(String paymentId, PaymentStatus status, String txReference, String note) {
        boolean[] found = new boolean[1];
        stateStore.update(state -> {
            for (PaymentRecord record : state.history) {
                if (record.id.equals(paymentId) && record.status == PaymentStatus.PENDING) {
                    found[0] = true;
                    if (status != null) {
                        record.status = status;
                    }
                    if (txReference != null) {
                        record.txReference = txReference;
                    }
                    if (note != null) {
                        record.note = note;
                    }
                    break;
                }
            }
        });
        return found[0];
    }

    public List<PaymentRecord> list() {
        return stateStore.read().history;
    }

    public List<PaymentRecord> clear() {
        return stateStore.update(state -> state.history.clear()).history;
    }
}
