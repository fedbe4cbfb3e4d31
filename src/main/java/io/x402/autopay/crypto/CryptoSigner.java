package io.x402.autopay.crypto;

import java.util.Map;

/** Minimal abstraction for creating cryptographic proofs over a payload.
 *  The agent signs EIP-712 typed data; {@link Web3jSigner} implements it with web3j.
 */
public interface CryptoSigner {

    /** Account the signatures recover to. */
    String address();

    /**
     * Returns a hex-encoded signature covering the given typed-data document
     * ({@code types}, {@code primaryType}, {@code domain}, {@code message}).
     */
    String sign(Map<String, Object> payload) throws SigningFailureException;
}
