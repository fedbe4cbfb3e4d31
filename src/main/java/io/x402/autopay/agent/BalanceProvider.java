package io.x402.autopay.agent;

import io.x402.autopay.model.BalanceCache;
import io.x402.autopay.model.ChainId;

import java.io.IOException;

/** Reads the wallet's token balance and its USD rate from a chain. */
@FunctionalInterface
public interface BalanceProvider {

    /**
     * @param chain       chain to query
     * @param address     wallet address
     * @param tokenSymbol token to read, e.g. "USDC"
     * @throws IOException when the chain or price source cannot be reached
     */
    BalanceCache fetchBalance(ChainId chain, String address, String tokenSymbol) throws IOException;
}
