package io.x402.autopay.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Last known token balance for one chain. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BalanceCache {
    public String tokenBalance = "0";
    public String rawBalance = "0";
    public double usd;
    public double usdRate = 1;
    /** Epoch millis, 0 when never fetched. */
    public long lastFetched;
    public String tokenSymbol = "USDC";
    public Integer decimals = 6;
    public String tokenAddress;

    /** Default constructor for Jackson. */
    public BalanceCache() {}

    public static BalanceCache empty(ChainId chain) {
        BalanceCache cache = new BalanceCache();
        cache.decimals = chain.usdcDecimals();
        cache.tokenAddress = chain.usdcAddress();
        return cache;
    }
}
