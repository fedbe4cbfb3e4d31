package io.x402.autopay.challenge;

import com.fasterxml.jackson.databind.JsonNode;
import io.x402.autopay.model.ChallengeDetails;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Dedicated challenge header holding JSON or base64 JSON. The object is either a flat
 * challenge or an x402 "accepts" document.
 */
final class JsonChallengeFormat implements ChallengeFormat {

    static final List<String> HEADERS = List.of("x-payment-challenge", "payment-required");

    @Override
    public Optional<ChallengeDetails> parse(ParseInput input) {
        for (String header : HEADERS) {
            Optional<ChallengeDetails> parsed = input.headers().get(header)
                .flatMap(value -> fromValue(value, input));
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    /** Also used for the challenge parameter of a WWW-Authenticate header. */
    static Optional<ChallengeDetails> fromValue(String value, ParseInput input) {
        return ChallengeValues.jsonObject(value).flatMap(node -> fromNode(node, input));
    }

    private static Optional<ChallengeDetails> fromNode(JsonNode node, ParseInput input) {
        if (AcceptsChallenge.hasAccepts(node)) {
            return AcceptsChallenge.from(node, input);
        }

        Optional<String> atomic = ChallengeValues.atomicAmount(
            ChallengeValues.firstPresent(node, "amount", "amountAtomic", "maxAmountRequired"));
        String seller = ChallengeValues.text(node, "seller", "payTo");
        String tokenAddress = ChallengeValues.text(node, "tokenAddress", "asset");
        String network = ChallengeValues.text(node, "network");
        OptionalLong chainId = ChallengeValues.chainId(node.get("chainId"));
        if (chainId.isEmpty()) {
            chainId = ChallengeValues.chainFromNetwork(network);
        }
        if (atomic.isEmpty() || chainId.isEmpty()
            || !ChallengeValues.isAddress(seller) || !ChallengeValues.isAddress(tokenAddress)) {
            return Optional.empty();
        }

        Integer decimals = ChallengeValues.decimals(node.get("tokenDecimals")).orElse(null);
        double amountUsd = ChallengeValues.number(node.get("amountUsd"))
            .filter(ChallengeValues::isUsdAmount)
            .orElseGet(() -> ChallengeValues.estimateUsd(atomic.get(), decimals));
        String id = ChallengeValues.text(node, "id");

        return Optional.of(ChallengeDetails.builder()
            .challengeId(id != null ? id : input.fallbackId())
            .origin(input.context().origin())
            .endpoint(input.context().endpoint())
            .method(input.context().method())
            .amountUsd(amountUsd)
            .tokenSymbol(ChallengeValues.tokenSymbol(ChallengeValues.text(node, "token", "tokenSymbol")))
            .chainId(chainId.getAsLong())
            .network(network)
            .tokenAddress(tokenAddress)
            .seller(seller)
            .amountAtomic(atomic.get())
            .tokenName(ChallengeValues.text(node, "tokenName"))
            .tokenVersion(ChallengeValues.text(node, "tokenVersion"))
            .tokenDecimals(decimals)
            .protocolVersion(ChallengeValues.integer(node.get("x402Version")).orElse(null))
            .rawHeaders(input.headers().asMap())
            .rawChallenge(node)
            .build());
    }
}
