package io.x402.autopay.crypto;

import io.x402.autopay.internal.Json;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.crypto.StructuredDataEncoder;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.util.Map;

/** EIP-712 signer backed by an in-memory secp256k1 key. */
public final class Web3jSigner implements CryptoSigner {

    private final Credentials credentials;

    public Web3jSigner(Credentials credentials) {
        this.credentials = credentials;
    }

    @Override
    public String address() {
        return Keys.toChecksumAddress(credentials.getAddress());
    }

    @Override
    public String sign(Map<String, Object> payload) throws SigningFailureException {
        try {
            byte[] digest = typedDataHash(payload);
            Sign.SignatureData signature = Sign.signMessage(digest, credentials.getEcKeyPair(), false);
            byte[] packed = new byte[65];
            System.arraycopy(signature.getR(), 0, packed, 0, 32);
            System.arraycopy(signature.getS(), 0, packed, 32, 32);
            packed[64] = signature.getV()[0];
            return Numeric.toHexString(packed);
        } catch (IOException | RuntimeException e) {
            throw new SigningFailureException("Failed to sign typed data", e);
        }
    }

    /** EIP-712 digest: keccak256(0x1901 || domainSeparator || hashStruct(message)). */
    public static byte[] typedDataHash(Map<String, Object> payload) throws IOException {
        String json = Json.mapper().writeValueAsString(payload);
        return new StructuredDataEncoder(json).hashStructuredData();
    }
}
