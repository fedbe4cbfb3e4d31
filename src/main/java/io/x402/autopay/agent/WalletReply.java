package io.x402.autopay.agent;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.x402.autopay.wallet.WalletView;

/** Reply to wallet lifecycle commands. {@code error} is set instead of throwing on bad input. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WalletReply(WalletView wallet, boolean locked, String error) {

    static WalletReply of(WalletView wallet) {
        return new WalletReply(wallet, wallet == null || wallet.locked(), null);
    }

    static WalletReply failure(String error) {
        return new WalletReply(null, true, error);
    }
}
