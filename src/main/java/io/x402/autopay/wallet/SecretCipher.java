package io.x402.autopay.wallet;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Passphrase-based encryption of the wallet key: PBKDF2-HMAC-SHA256 derives an AES-256 key
 * from the passphrase and a random salt; AES-GCM encrypts and authenticates the secret.
 */
public final class SecretCipher {

    static final int SALT_BYTES = 16;
    static final int IV_BYTES = 12;
    private static final int KEY_BITS = 256;
    private static final int TAG_BITS = 128;
    private static final String KDF = "PBKDF2WithHmacSHA256";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private final int iterations;
    private final SecureRandom random;

    public SecretCipher(int iterations) {
        this(iterations, new SecureRandom());
    }

    SecretCipher(int iterations, SecureRandom random) {
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be positive");
        }
        this.iterations = iterations;
        this.random = random;
    }

    public EncryptedSecret encrypt(String secret, String passphrase) throws GeneralSecurityException {
        byte[] salt = new byte[SALT_BYTES];
        byte[] iv = new byte[IV_BYTES];
        random.nextBytes(salt);
        random.nextBytes(iv);
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.ENCRYPT_MODE, deriveKey(passphrase, salt), new GCMParameterSpec(TAG_BITS, iv));
        byte[] cipherText = cipher.doFinal(secret.getBytes(StandardCharsets.UTF_8));
        Base64.Encoder encoder = Base64.getEncoder();
        return new EncryptedSecret(encoder.encodeToString(cipherText), encoder.encodeToString(salt), encoder.encodeToString(iv));
    }

    /**
     * @throws GeneralSecurityException on a wrong passphrase or tampered ciphertext
     *                                  ({@link javax.crypto.AEADBadTagException})
     */
    public String decrypt(EncryptedSecret encrypted, String passphrase) throws GeneralSecurityException {
        if (encrypted.salt() == null || encrypted.iv() == null || encrypted.cipherText() == null) {
            throw new GeneralSecurityException("Encrypted secret is incomplete");
        }
        Base64.Decoder decoder = Base64.getDecoder();
        byte[] salt;
        byte[] iv;
        byte[] cipherText;
        try {
            salt = decoder.decode(encrypted.salt());
            iv = decoder.decode(encrypted.iv());
            cipherText = decoder.decode(encrypted.cipherText());
        } catch (IllegalArgumentException e) {
            throw new GeneralSecurityException("Encrypted secret is not valid base64", e);
        }
        if (salt.length != SALT_BYTES || iv.length != IV_BYTES || cipherText.length == 0) {
            throw new GeneralSecurityException("Encrypted secret has malformed parameters");
        }
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.DECRYPT_MODE, deriveKey(passphrase, salt), new GCMParameterSpec(TAG_BITS, iv));
        return new String(cipher.doFinal(cipherText), StandardCharsets.UTF_8);
    }

    private SecretKey deriveKey(String passphrase, byte[] salt) throws GeneralSecurityException {
        PBEKeySpec spec = new PBEKeySpec(passphrase.toCharArray(), salt, iterations, KEY_BITS);
        try {
            byte[] keyBytes = SecretKeyFactory.getInstance(KDF).generateSecret(spec).getEncoded();
            return new SecretKeySpec(keyBytes, "AES");
        } finally {
            spec.clearPassword();
        }
    }
}
