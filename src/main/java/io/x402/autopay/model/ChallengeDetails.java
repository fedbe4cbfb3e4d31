package io.x402.autopay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Objects;

/**
 * Canonical form of a payment challenge, whatever encoding the resource server used.
 *
 * @param challengeId     server-supplied id, or a random UUID when the server sent none
 * @param origin          scheme://host[:port] of the resource
 * @param endpoint        request path of the resource
 * @param method          HTTP method of the original request
 * @param amountUsd       advisory USD figure; never part of the signed authorization
 * @param tokenSymbol     e.g. "USDC"
 * @param chainId         EVM chain id
 * @param network         network descriptor the server asked for, e.g. "eip155:80002"
 * @param tokenAddress    token contract (EIP-712 verifying contract)
 * @param seller          recipient of the transfer
 * @param amountAtomic    base-10 integer amount in the token's smallest unit
 * @param tokenName       EIP-712 domain name of the token
 * @param tokenVersion    EIP-712 domain version of the token
 * @param tokenDecimals   decimals used for the USD estimate
 * @param protocolVersion x402 protocol version hinted by the challenge
 * @param rawHeaders      response headers, lower-cased names
 * @param rawChallenge    the decoded challenge structure, when there was one
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChallengeDetails(
    String challengeId,
    String origin,
    String endpoint,
    String method,
    double amountUsd,
    String tokenSymbol,
    long chainId,
    String network,
    String tokenAddress,
    String seller,
    String amountAtomic,
    String tokenName,
    String tokenVersion,
    Integer tokenDecimals,
    Integer protocolVersion,
    Map<String, String> rawHeaders,
    JsonNode rawChallenge) {

    public ChallengeDetails {
        Objects.requireNonNull(challengeId, "challengeId");
        Objects.requireNonNull(tokenAddress, "tokenAddress");
        Objects.requireNonNull(seller, "seller");
        Objects.requireNonNull(amountAtomic, "amountAtomic");
        rawHeaders = rawHeaders == null ? Map.of() : Map.copyOf(rawHeaders);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String challengeId;
        private String origin;
        private String endpoint;
        private String method;
        private double amountUsd;
        private String tokenSymbol = "USDC";
        private long chainId;
        private String network;
        private String tokenAddress;
        private String seller;
        private String amountAtomic;
        private String tokenName;
        private String tokenVersion;
        private Integer tokenDecimals;
        private Integer protocolVersion;
        private Map<String, String> rawHeaders;
        private JsonNode rawChallenge;

        public Builder challengeId(String challengeId) {
            this.challengeId = challengeId;
            return this;
        }

        public Builder origin(String origin) {
            this.origin = origin;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder amountUsd(double amountUsd) {
            this.amountUsd = amountUsd;
            return this;
        }

        public Builder tokenSymbol(String tokenSymbol) {
            this.tokenSymbol = tokenSymbol;
            return this;
        }

        public Builder chainId(long chainId) {
            this.chainId = chainId;
            return this;
        }

        public Builder network(String network) {
            this.network = network;
            return this;
        }

        public Builder tokenAddress(String tokenAddress) {
            this.tokenAddress = tokenAddress;
            return this;
        }

        public Builder seller(String seller) {
            this.seller = seller;
            return this;
        }

        public Builder amountAtomic(String amountAtomic) {
            this.amountAtomic = amountAtomic;
            return this;
        }

        public Builder tokenName(String tokenName) {
            this.tokenName = tokenName;
            return this;
        }

        public Builder tokenVersion(String tokenVersion) {
            this.tokenVersion = tokenVersion;
            return this;
        }

        public Builder tokenDecimals(Integer tokenDecimals) {
            this.tokenDecimals = tokenDecimals;
            return this;
        }

        public Builder protocolVersion(Integer protocolVersion) {
            this.protocolVersion = protocolVersion;
            return this;
        }

        public Builder rawHeaders(Map<String, String> rawHeaders) {
            this.rawHeaders = rawHeaders;
            return this;
        }

        public Builder rawChallenge(JsonNode rawChallenge) {
            this.rawChallenge = rawChallenge;
            return this;
        }

        public ChallengeDetails build() {
            return new ChallengeDetails(challengeId, origin, endpoint, method, amountUsd, tokenSymbol,
                chainId, network, tokenAddress, seller, amountAtomic, tokenName, tokenVersion,
                tokenDecimals, protocolVersion, rawHeaders, rawChallenge);
        }
    }
}
