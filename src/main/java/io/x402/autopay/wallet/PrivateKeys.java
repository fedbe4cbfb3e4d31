package io.x402.autopay.wallet;

import org.web3j.crypto.Credentials;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

/** Validation of raw secp256k1 private keys. */
final class PrivateKeys {

    private static final Pattern HEX_KEY = Pattern.compile("^[0-9a-fA-F]{64}$");

    private PrivateKeys() {
    }

    /** Canonical "0x" + 64 lower-case hex digits. */
    static String normalize(String secret) throws InvalidSecretException {
        if (secret == null || secret.isBlank()) {
            throw new InvalidSecretException("Private key required");
        }
        String hex = secret.trim();
        if (hex.startsWith("0x") || hex.startsWith("0X")) {
            hex = hex.substring(2);
        }
        if (!HEX_KEY.matcher(hex).matches()) {
            throw new InvalidSecretException("Private key must be 32 bytes of hex");
        }
        BigInteger key = new BigInteger(hex, 16);
        if (key.signum() == 0 || key.compareTo(Sign.CURVE_PARAMS.getN()) >= 0) {
            throw new InvalidSecretException("Private key is outside the secp256k1 range");
        }
        return "0x" + hex.toLowerCase(Locale.ROOT);
    }

    static Credentials credentials(String normalizedSecret) {
        return Credentials.create(ECKeyPair.create(new BigInteger(normalizedSecret.substring(2), 16)));
    }

    /** EIP-55 checksummed address of the key. */
    static String address(Credentials credentials) {
        return Keys.toChecksumAddress(credentials.getAddress());
    }
}
