package io.x402.autopay.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Persisted wallet. Holds only the encrypted key; the decrypted key lives in
 * {@code io.x402.autopay.wallet.WalletSession} and has no field here.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WalletRecord {
    public String address;
    public String encryptedSecret;   // base64 AES-GCM ciphertext with tag
    public String encryptionSalt;    // base64
    public String encryptionIv;      // base64
    public int lockDurationMinutes;
    /** Always 0 in the persisted form; the live expiry belongs to the session. */
    public long lockedUntil;
    public String label;

    /** Default constructor for Jackson. */
    public WalletRecord() {}

    public boolean hasEncryptedSecret() {
        return encryptedSecret != null && encryptionSalt != null && encryptionIv != null;
    }
}
