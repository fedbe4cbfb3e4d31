package io.x402.autopay;

import io.x402.autopay.model.ChainId;
import io.x402.autopay.model.ChallengeDetails;

import java.math.BigDecimal;
import java.util.Map;

/** Shared keys, addresses and challenge builders for tests. */
public final class TestChallenges {

    /** Well-known development key; never holds funds. */
    public static final String TEST_KEY = "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80";
    public static final String TEST_ADDRESS = "0xf39Fd6e51aad88F6F4ce6aB8827279cffFb92266";
    public static final String PASSPHRASE = "pw1234567";

    public static final String SELLER = "0x209693Bc6afc0C5328bA36FaF03C514EF312287C";
    public static final String OTHER_SELLER = "0x1111111111111111111111111111111111111111";
    public static final String USDC_AMOY = ChainId.POLYGON_AMOY.usdcAddress();
    public static final String ORIGIN = "https://api.example.com";

    /** Cheap key derivation so tests do not spend seconds in PBKDF2. */
    public static final int TEST_ITERATIONS = 1_000;

    private TestChallenges() {
    }

    public static ChallengeDetails challenge(String id, double amountUsd) {
        return challenge(id, ORIGIN, amountUsd);
    }

    public static ChallengeDetails challenge(String id, String origin, double amountUsd) {
        String atomic = BigDecimal.valueOf(amountUsd).movePointRight(6).toBigInteger().toString();
        return ChallengeDetails.builder()
            .challengeId(id)
            .origin(origin)
            .endpoint("/premium")
            .method("GET")
            .amountUsd(amountUsd)
            .tokenSymbol("USDC")
            .chainId(ChainId.POLYGON_AMOY.chainId())
            .tokenAddress(USDC_AMOY)
            .seller(SELLER)
            .amountAtomic(atomic)
            .rawHeaders(Map.of())
            .build();
    }
}
