package io.x402.autopay.wallet;

import io.x402.autopay.config.AgentConfig;
import io.x402.autopay.model.WalletRecord;
import io.x402.autopay.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Credentials;

import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Owns the wallet key: encrypted at rest in the state document, decrypted only into a
 * {@link WalletSession} that expires after the configured lock duration.
 */
public class WalletVault {

    private static final Logger LOG = LoggerFactory.getLogger(WalletVault.class);

    public static final int MIN_PASSPHRASE_LENGTH = 8;

    private final StateStore stateStore;
    private final Clock clock;
    private final SecretCipher cipher;
    private final int defaultLockMinutes;
    private WalletSession session;

    public WalletVault(StateStore stateStore, Clock clock, SecretCipher cipher, int defaultLockMinutes) {
        this.stateStore = stateStore;
        this.clock = clock;
        this.cipher = cipher;
        this.defaultLockMinutes = AgentConfig.clampLockMinutes(defaultLockMinutes);
    }

    public WalletVault(StateStore stateStore, AgentConfig config) {
        this(stateStore, config.getClock(), new SecretCipher(config.getKeyDerivationIterations()),
            config.getDefaultLockMinutes());
    }

    /**
     * Encrypts and stores a new key, replacing any existing wallet, and unlocks it.
     *
     * @param lockMinutes unlock duration; null selects the default
     * @throws InvalidSecretException   when the secret is not a secp256k1 private key
     * @throws IllegalArgumentException when the passphrase is too short
     */
    public synchronized WalletView configure(String secret, String passphrase, Integer lockMinutes, String label)
        throws InvalidSecretException {
        String normalized = PrivateKeys.normalize(secret);
        if (passphrase == null || passphrase.length() < MIN_PASSPHRASE_LENGTH) {
            throw new IllegalArgumentException("Passphrase must be at least " + MIN_PASSPHRASE_LENGTH + " characters");
        }
        int minutes = resolveLockMinutes(lockMinutes, defaultLockMinutes);
        Credentials credentials = PrivateKeys.credentials(normalized);
        String address = PrivateKeys.address(credentials);

        EncryptedSecret encrypted;
        try {
            encrypted = cipher.encrypt(normalized, passphrase);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Key encryption is unavailable", e);
        }

        WalletRecord record = new WalletRecord();
        record.address = address;
        record.encryptedSecret = encrypted.cipherText();
        record.encryptionSalt = encrypted.salt();
        record.encryptionIv = encrypted.iv();
        record.lockDurationMinutes = minutes;
        record.lockedUntil = 0;
        record.label = label;
        stateStore.update(state -> state.wallet = record);

        openSession(credentials, address, minutes);
        LOG.info("Configured wallet {} (unlocked for {} min)", address, minutes);
        return view();
    }

    /**
     * @param lockMinutes unlock duration; null keeps the stored duration
     * @throws IncorrectPassphraseException when decryption or address verification fails
     */
    public synchronized WalletView unlock(String passphrase, Integer lockMinutes)
        throws WalletNotConfiguredException, IncorrectPassphraseException {
        WalletRecord record = requireRecord();
        Credentials credentials = PrivateKeys.credentials(decryptVerified(record, passphrase));
        int minutes = resolveLockMinutes(lockMinutes, record.lockDurationMinutes);
        stateStore.update(state -> {
            if (state.wallet != null) {
                state.wallet.lockDurationMinutes = minutes;
            }
        });
        openSession(credentials, record.address, minutes);
        LOG.info("Unlocked wallet {} for {} min", record.address, minutes);
        return view();
    }

    public synchronized WalletView lock() {
        destroySession();
        LOG.info("Wallet locked");
        return view();
    }

    /** Returns the private key hex. Requires the passphrase even while unlocked. */
    public synchronized String exportSecret(String passphrase)
        throws WalletNotConfiguredException, IncorrectPassphraseException {
        String secret = decryptVerified(requireRecord(), passphrase);
        LOG.info("Exported wallet key");
        return secret;
    }

    public synchronized WalletView remove() {
        destroySession();
        stateStore.update(state -> state.wallet = null);
        LOG.info("Wallet removed");
        return view();
    }

    /** The live session, if one exists and has not expired. */
    public synchronized Optional<WalletSession> activeSession() {
        if (session == null) {
            return Optional.empty();
        }
        if (!session.isActive(clock.millis())) {
            LOG.debug("Wallet session expired");
            destroySession();
            return Optional.empty();
        }
        return Optional.of(session);
    }

    public WalletSession requireSession() throws WalletLockedException {
        return activeSession().orElseThrow(WalletLockedException::new);
    }

    /** Slides the active session's expiry forward; no-op when locked. */
    public synchronized void renew() {
        activeSession().ifPresent(active -> active.renew(clock.millis()));
    }

    public synchronized WalletState state() {
        if (stateStore.read().wallet == null) {
            return WalletState.UNCONFIGURED;
        }
        return activeSession().isPresent() ? WalletState.UNLOCKED : WalletState.LOCKED;
    }

    /** Redacted view with the live lock expiry; null when no wallet is configured. */
    public synchronized WalletView view() {
        return view(stateStore.read().wallet);
    }

    public synchronized WalletView view(WalletRecord record) {
        if (record == null) {
            return null;
        }
        Optional<WalletSession> active = activeSession();
        return new WalletView(
            record.address,
            record.label,
            record.lockDurationMinutes,
            active.map(WalletSession::unlockedUntil).orElse(0L),
            active.isEmpty(),
            record.hasEncryptedSecret());
    }

    static int resolveLockMinutes(Integer requested, int fallback) {
        if (requested == null) {
            return fallback > 0 ? AgentConfig.clampLockMinutes(fallback) : AgentConfig.DEFAULT_LOCK_MINUTES;
        }
        return AgentConfig.clampLockMinutes(requested);
    }

    private WalletRecord requireRecord() throws WalletNotConfiguredException {
        WalletRecord record = stateStore.read().wallet;
        if (record == null || !record.hasEncryptedSecret()) {
            throw new WalletNotConfiguredException();
        }
        return record;
    }

    private String decryptVerified(WalletRecord record, String passphrase) throws IncorrectPassphraseException {
        if (passphrase == null) {
            throw new IncorrectPassphraseException();
        }
        try {
            String secret = cipher.decrypt(
                new EncryptedSecret(record.encryptedSecret, record.encryptionSalt, record.encryptionIv), passphrase);
            String normalized = PrivateKeys.normalize(secret);
            String derived = PrivateKeys.address(PrivateKeys.credentials(normalized));
            if (!derived.equalsIgnoreCase(record.address)) {
                LOG.warn("Decrypted key does not match wallet address {}", record.address);
                throw new IncorrectPassphraseException();
            }
            return normalized;
        } catch (GeneralSecurityException | InvalidSecretException e) {
            LOG.debug("Wallet decryption failed: {}", e.getClass().getSimpleName());
            throw new IncorrectPassphraseException();
        }
    }

    private void openSession(Credentials credentials, String address, int minutes) {
        destroySession();
        session = new WalletSession(credentials, address, Duration.ofMinutes(minutes), clock.millis());
    }

    private void destroySession() {
        if (session != null) {
            session.destroy();
            session = null;
        }
    }
}
