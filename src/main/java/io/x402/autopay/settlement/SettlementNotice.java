package io.x402.autopay.settlement;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.x402.autopay.model.PaymentStatus;

/**
 * Settlement outcome for one payment, as reported to the agent.
 *
 * @param status explicit outcome; when null the outcome follows from {@code txReference}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SettlementNotice(
    String paymentId,
    String txReference,
    String network,
    String token,
    PaymentStatus status,
    String message) {

    public static SettlementNotice of(String paymentId, SettlementReceipt receipt) {
        PaymentStatus status = Boolean.FALSE.equals(receipt.success()) ? PaymentStatus.ERROR : null;
        return new SettlementNotice(
            paymentId != null ? paymentId : receipt.paymentId(),
            receipt.transactionReference(),
            receipt.network(),
            receipt.token(),
            status,
            receipt.errorReason());
    }

    /** SUCCESS when a transaction reference is present, ERROR otherwise, unless a status was given. */
    public PaymentStatus resolvedStatus() {
        if (status != null) {
            return status;
        }
        return txReference != null && !txReference.isBlank() ? PaymentStatus.SUCCESS : PaymentStatus.ERROR;
    }
}
