package io.x402.autopay.wallet;

import io.x402.autopay.PaymentAgentException;

/** No unlocked wallet session is available. */
public class WalletLockedException extends PaymentAgentException {

    private static final long serialVersionUID = 1L;

    public WalletLockedException() {
        super("Wallet locked");
    }
}
