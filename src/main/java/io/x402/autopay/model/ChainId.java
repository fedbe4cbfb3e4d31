package io.x402.autopay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/** Chains the agent can pay on, with the USDC deployment it uses on each. */
public enum ChainId {
    POLYGON("polygon", 137L, "polygon", "0x3c499c542cEF5E3811e1192ce70d8cC03d5c3359", 6),
    POLYGON_AMOY("polygonAmoy", 80002L, "polygon-amoy", "0x41E94Eb019C0762f9Bfcf9Fb1E58725BfB0e7582", 6);

    private final String key;
    private final long chainId;
    private final String canonicalNetwork;
    private final String usdcAddress;
    private final int usdcDecimals;

    ChainId(String key, long chainId, String canonicalNetwork, String usdcAddress, int usdcDecimals) {
        this.key = key;
        this.chainId = chainId;
        this.canonicalNetwork = canonicalNetwork;
        this.usdcAddress = usdcAddress;
        this.usdcDecimals = usdcDecimals;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public long chainId() {
        return chainId;
    }

    /** Network name used in v1 payment headers, e.g. "polygon-amoy". */
    public String canonicalNetwork() {
        return canonicalNetwork;
    }

    public String usdcAddress() {
        return usdcAddress;
    }

    public int usdcDecimals() {
        return usdcDecimals;
    }

    public static Optional<ChainId> fromChainId(long chainId) {
        for (ChainId candidate : values()) {
            if (candidate.chainId == chainId) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static ChainId fromKey(String key) {
        for (ChainId candidate : values()) {
            if (candidate.key.equalsIgnoreCase(key) || candidate.name().equalsIgnoreCase(key)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("unsupported chain " + key);
    }
}
