package io.x402.autopay.challenge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.x402.autopay.internal.Json;
import io.x402.autopay.model.ChallengeDetails;
import io.x402.autopay.model.PaymentRequiredResponse;
import io.x402.autopay.model.PaymentRequirements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Reads a 402 document carrying an "accepts" array and picks its first "exact" entry.
 */
final class AcceptsChallenge {

    private static final Logger LOG = LoggerFactory.getLogger(AcceptsChallenge.class);
    private static final String DEFAULT_NETWORK = "eip155:" + ChallengeValues.DEFAULT_CHAIN_ID;

    private AcceptsChallenge() {
    }

    static boolean hasAccepts(JsonNode root) {
        JsonNode accepts = root.get("accepts");
        return accepts != null && accepts.isArray();
    }

    static Optional<ChallengeDetails> from(JsonNode root, ChallengeFormat.ParseInput input) {
        Optional<PaymentRequiredResponse> response = toResponse(root);
        if (response.isEmpty()) {
            return Optional.empty();
        }
        PaymentRequiredResponse required = response.get();
        PaymentRequirements exact = required.firstExact();
        if (exact == null) {
            LOG.debug("accepts array has no exact entry for {}{}", input.context().origin(), input.context().endpoint());
            return Optional.empty();
        }

        Optional<String> atomic = ChallengeValues.atomicAmount(exact.atomicAmount());
        if (atomic.isEmpty()) {
            LOG.debug("exact entry has no usable atomic amount");
            return Optional.empty();
        }
        String payTo = exact.payTo != null ? exact.payTo : exact.extraString("recipientAddress");
        String asset = exact.asset;
        if (!ChallengeValues.isAddress(payTo) || !ChallengeValues.isAddress(asset)) {
            LOG.debug("exact entry has an invalid payTo or asset");
            return Optional.empty();
        }

        Integer decimals = extraDecimals(exact, "decimals").orElse(ChallengeValues.DEFAULT_DECIMALS);
        String symbol = exact.extraString("symbol") != null ? exact.extraString("symbol") : required.token;
        double amountUsd = Optional.ofNullable(required.amountUsd)
            .or(() -> Optional.ofNullable(exact.amountUsd))
            .or(() -> ChallengeValues.number(Json.mapper().valueToTree(exact.extraValue("amountUsd"))))
            .filter(ChallengeValues::isUsdAmount)
            .orElseGet(() -> ChallengeValues.estimateUsd(atomic.get(), decimals));

        String network = firstNonBlank(exact.network, required.network, DEFAULT_NETWORK);
        long chainId = ChallengeValues.chainFromNetwork(network).orElse(ChallengeValues.DEFAULT_CHAIN_ID);
        Integer version = exact.x402Version != null ? exact.x402Version : required.x402Version;
        String challengeId = required.id != null && !required.id.isBlank() ? required.id : input.fallbackId();

        return Optional.of(ChallengeDetails.builder()
            .challengeId(challengeId)
            .origin(input.context().origin())
            .endpoint(input.context().endpoint())
            .method(input.context().method())
            .amountUsd(amountUsd)
            .tokenSymbol(ChallengeValues.tokenSymbol(symbol))
            .chainId(chainId)
            .network(network)
            .tokenAddress(asset)
            .seller(payTo)
            .amountAtomic(atomic.get())
            .tokenName(exact.extraString("name"))
            .tokenVersion(exact.extraString("version"))
            .tokenDecimals(decimals)
            .protocolVersion(version)
            .rawHeaders(input.headers().asMap())
            .rawChallenge(root)
            .build());
    }

    private static Optional<PaymentRequiredResponse> toResponse(JsonNode root) {
        ObjectNode copy = ((ObjectNode) root).deepCopy();
        ArrayNode objectsOnly = copy.putArray("accepts");
        for (JsonNode entry : root.get("accepts")) {
            if (entry != null && entry.isObject()) {
                objectsOnly.add(entry);
            }
        }
        try {
            return Optional.of(Json.mapper().treeToValue(copy, PaymentRequiredResponse.class));
        } catch (JsonProcessingException e) {
            LOG.debug("402 document does not match the accepts layout: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static Optional<Integer> extraDecimals(PaymentRequirements exact, String key) {
        Object value = exact.extraValue(key);
        if (value == null) {
            return Optional.empty();
        }
        return ChallengeValues.decimals(Json.mapper().valueToTree(value));
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
