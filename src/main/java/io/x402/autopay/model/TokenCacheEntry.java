package io.x402.autopay.model;

/** Short-lived access token a server returned with a settlement. */
public class TokenCacheEntry {
    public String paymentId;
    public String token;
    /** Epoch millis. */
    public long expiresAt;

    /** Default constructor for Jackson. */
    public TokenCacheEntry() {}

    public TokenCacheEntry(String paymentId, String token, long expiresAt) {
        this.paymentId = paymentId;
        this.token = token;
        this.expiresAt = expiresAt;
    }
}
