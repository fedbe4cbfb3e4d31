package io.x402.autopay.crypto;

import io.x402.autopay.PaymentAgentException;

/** A signature could not be produced. */
public class SigningFailureException extends PaymentAgentException {

    private static final long serialVersionUID = 1L;

    public SigningFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
