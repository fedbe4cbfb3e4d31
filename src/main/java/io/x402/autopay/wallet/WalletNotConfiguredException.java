package io.x402.autopay.wallet;

import io.x402.autopay.PaymentAgentException;

/** No wallet has been configured. */
public class WalletNotConfiguredException extends PaymentAgentException {

    private static final long serialVersionUID = 1L;

    public WalletNotConfiguredException() {
        super("Wallet not configured");
    }
}
