package io.x402.autopay.wallet;

import io.x402.autopay.PaymentAgentException;

/** The passphrase did not unlock the stored key, or the key did not match the wallet address. */
public class IncorrectPassphraseException extends PaymentAgentException {

    private static final long serialVersionUID = 1L;

    public IncorrectPassphraseException() {
        super("Incorrect passphrase");
    }
}
