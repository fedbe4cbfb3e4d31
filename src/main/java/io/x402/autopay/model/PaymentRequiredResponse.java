package io.x402.autopay.model;

import java.util.ArrayList;
import java.util.List;

/** HTTP 402 response body returned by an x402-enabled server. */
public class PaymentRequiredResponse {
    public Integer x402Version;
    public List<PaymentRequirements> accepts = new ArrayList<>();
    public String error;
    public String id;
    public String token;
    public Double amountUsd;
    public String network;
    // Root-level resource metadata
    public String resource;
    public String description;
    public String mimeType;
    public Integer maxTimeoutSeconds;

    /** First entry using the "exact" scheme, or null. */
    public PaymentRequirements firstExact() {
        if (accepts == null) {
            return null;
        }
        for (PaymentRequirements entry : accepts) {
            if (entry != null && "exact".equals(entry.scheme)) {
                return entry;
            }
        }
        return null;
    }
}
