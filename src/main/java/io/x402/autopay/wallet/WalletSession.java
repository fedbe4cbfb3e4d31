package io.x402.autopay.wallet;

import com.fasterxml.jackson.annotation.JsonIgnoreType;
import io.x402.autopay.crypto.CryptoSigner;
import io.x402.autopay.crypto.Web3jSigner;
import org.web3j.crypto.Credentials;

import java.time.Duration;

/**
 * Unlocked wallet key held in memory for a bounded time. Never persisted and never sent over
 * the agent bus; {@link #toString()} does not include key material.
 */
@JsonIgnoreType
public final class WalletSession {

    private final String address;
    private final Duration lockDuration;
    private volatile Credentials credentials;
    private volatile long unlockedUntil;

    WalletSession(Credentials credentials, String address, Duration lockDuration, long now) {
        this.credentials = credentials;
        this.address = address;
        this.lockDuration = lockDuration;
        this.unlockedUntil = now + lockDuration.toMillis();
    }

    public String address() {
        return address;
    }

    /** Epoch millis after which the session no longer signs. */
    public long unlockedUntil() {
        return unlockedUntil;
    }

    public Duration lockDuration() {
        return lockDuration;
    }

    public boolean isActive(long now) {
        return credentials != null && now < unlockedUntil;
    }

    /**
     * @throws WalletLockedException when the session was destroyed
     */
    public CryptoSigner signer() throws WalletLockedException {
        Credentials current = credentials;
        if (current == null) {
            throw new WalletLockedException();
        }
        return new Web3jSigner(current);
    }

    /** Slides the expiry forward by the session's lock duration. */
    void renew(long now) {
        if (credentials != null) {
            unlockedUntil = now + lockDuration.toMillis();
        }
    }

    void destroy() {
        credentials = null;
        unlockedUntil = 0;
    }

    @Override
    public String toString() {
        return "WalletSession{address=" + address + ", unlockedUntil=" + unlockedUntil + ", key=<redacted>}";
    }
}
