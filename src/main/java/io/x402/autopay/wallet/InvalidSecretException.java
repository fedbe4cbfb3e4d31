package io.x402.autopay.wallet;

import io.x402.autopay.PaymentAgentException;

/** Secret material that cannot be turned into a signing key. */
public class InvalidSecretException extends PaymentAgentException {

    private static final long serialVersionUID = 1L;

    public InvalidSecretException(String message) {
        super(message);
    }
}
