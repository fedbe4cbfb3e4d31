package io.x402.autopay.wallet;

/** Lifecycle of the wallet key. */
public enum WalletState {
    /** No wallet record. */
    UNCONFIGURED,
    /** Encrypted key on disk, no live session. */
    LOCKED,
    /** A session holds the decrypted key until it expires. */
    UNLOCKED
}
