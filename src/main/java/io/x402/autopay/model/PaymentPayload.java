package io.x402.autopay.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Object that is JSON-encoded and base64-encoded into the X-PAYMENT request header. */
@JsonPropertyOrder({"x402Version", "scheme", "network", "payload"})
public class PaymentPayload {
    public int x402Version;
    public String scheme;      // always "exact"
    public String network;
    public Exact payload;

    /** Signed authorization carried by the "exact" scheme. */
    public static class Exact {
        public TransferAuthorization authorization;
        public String signature;

        public Exact() {}

        public Exact(TransferAuthorization authorization, String signature) {
            this.authorization = authorization;
            this.signature = signature;
        }
    }
}
