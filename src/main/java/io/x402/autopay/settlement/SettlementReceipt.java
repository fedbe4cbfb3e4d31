package io.x402.autopay.settlement;

import io.x402.autopay.model.SettlementResponseHeader;

/**
 * What a resource server reported about a settled payment. Every field is optional.
 *
 * @param transactionReference on-chain transaction hash
 * @param network              network name or chain id as text
 * @param token                short-lived access token for the paid resource
 * @param paymentId            payment id echoed by the server
 * @param success              explicit outcome, when the server stated one
 * @param errorReason          failure reason, when the server stated one
 */
public record SettlementReceipt(
    String transactionReference,
    String network,
    String token,
    String paymentId,
    Boolean success,
    String errorReason) {

    static SettlementReceipt of(SettlementResponseHeader header) {
        return new SettlementReceipt(
            header.transactionReference(),
            header.networkText(),
            header.jwt,
            header.paymentId,
            header.success,
            header.errorReason);
    }

    static SettlementReceipt tokenOnly(String token) {
        return new SettlementReceipt(null, null, token, null, null, null);
    }
}
