package io.x402.autopay.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/** One acceptable way to pay for a resource, as listed in a 402 body's "accepts" array. */
public class PaymentRequirements {
    public String scheme;              // e.g. "exact"
    public String network;             // e.g. "eip155:80002" or "polygon-amoy"
    public JsonNode maxAmountRequired; // atomic units; decimal string, hex string or number
    public JsonNode amount;            // v2 name for the same field
    public String payTo;               // recipient address
    public String asset;               // token contract address
    public Integer x402Version;
    public Double amountUsd;
    public Map<String, Object> extra;  // scheme-specific: name, version, decimals, recipientAddress

    /** The atomic amount node, preferring {@code maxAmountRequired}. */
    public JsonNode atomicAmount() {
        if (maxAmountRequired != null && !maxAmountRequired.isNull()) {
            return maxAmountRequired;
        }
        return amount;
    }

    public String extraString(String key) {
        Object value = extra == null ? null : extra.get(key);
        return value instanceof String ? (String) value : null;
    }

    public Object extraValue(String key) {
        return extra == null ? null : extra.get(key);
    }
}
