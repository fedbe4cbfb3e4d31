package io.x402.autopay.wallet;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Wallet as shown to callers: address and lock status, never key material.
 *
 * @param lockedUntil epoch millis of the live session's expiry, 0 when locked
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WalletView(
    String address,
    String label,
    int lockDurationMinutes,
    long lockedUntil,
    boolean locked,
    boolean configured) {
}
