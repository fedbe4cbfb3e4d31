package io.x402.autopay.wallet;

/**
 * AES-GCM ciphertext of the private key with the parameters needed to decrypt it, all base64.
 */
public record EncryptedSecret(String cipherText, String salt, String iv) {
}
