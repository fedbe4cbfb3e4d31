package io.x402.autopay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Settlement acknowledgment a resource server returns in X-PAYMENT-RESPONSE.
 * Servers disagree on field names, so both spellings of the transaction reference are accepted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SettlementResponseHeader {
    /** Whether the settlement was successful; absent on some servers. */
    public Boolean success;

    /** Transaction hash of the settled payment. */
    public String transaction;

    /** Older servers call it txHash. */
    public String txHash;

    /** Network where the settlement occurred; a name or a numeric chain id. */
    public JsonNode network;

    /** Wallet address of the payer (can be null). */
    public String payer;

    /** Short-lived access token granted for the paid resource. */
    public String jwt;

    /** Payment id echoed by the server. */
    public String paymentId;

    /** Reason the settlement failed (can be null). */
    public String errorReason;

    /** Default constructor for Jackson. */
    public SettlementResponseHeader() {}

    public String transactionReference() {
        if (transaction != null && !transaction.isBlank()) {
            return transaction;
        }
        return txHash != null && !txHash.isBlank() ? txHash : null;
    }

    public String networkText() {
        if (network == null || network.isNull()) {
            return null;
        }
        return network.asText();
    }
}
