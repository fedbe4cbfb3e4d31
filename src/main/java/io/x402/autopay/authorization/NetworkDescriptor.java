package io.x402.autopay.authorization;

import com.fasterxml.jackson.databind.JsonNode;
import io.x402.autopay.model.AgentSettings;
import io.x402.autopay.model.ChallengeDetails;

/**
 * Network name and protocol version written into the payment header.
 *
 * <p>The network is taken from the first non-blank of: the challenge's own network, the first
 * {@code exact} entry of {@code accepts}, the raw challenge's {@code network}, {@code eip155:<chainId>},
 * the configured chain's canonical name. A version hint of 1 or 2 is honored; otherwise
 * CAIP-2 style descriptors ("eip155:137") select version 2 and bare names version 1.</p>
 */
public record NetworkDescriptor(String network, int version) {

    public static NetworkDescriptor resolve(ChallengeDetails challenge, AgentSettings settings) {
        JsonNode raw = challenge.rawChallenge();
        JsonNode exact = firstExact(raw);

        String network = firstNonBlank(
            challenge.network(),
            text(exact, "network"),
            text(raw, "network"));
        if (network == null) {
            network = challenge.chainId() > 0
                ? "eip155:" + challenge.chainId()
                : settings.chain.canonicalNetwork();
        }

        Integer hinted = challenge.protocolVersion();
        if (hinted == null) {
            hinted = firstInt(integer(raw, "x402Version"), integer(exact, "x402Version"), integer(raw, "version"));
        }
        int version;
        if (hinted != null && (hinted == 1 || hinted == 2)) {
            version = hinted;
        } else {
            version = network.contains(":") ? 2 : 1;
        }
        return new NetworkDescriptor(network, version);
    }

    private static JsonNode firstExact(JsonNode raw) {
        if (raw == null || !raw.path("accepts").isArray()) {
            return null;
        }
        for (JsonNode entry : raw.get("accepts")) {
            if (entry.isObject() && "exact".equals(entry.path("scheme").asText(null))) {
                return entry;
            }
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        if (node == null || !node.path(field).isTextual()) {
            return null;
        }
        return node.get(field).asText();
    }

    private static Integer integer(JsonNode node, String field) {
        if (node == null || !node.path(field).isNumber()) {
            return null;
        }
        return node.get(field).asInt();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static Integer firstInt(Integer... values) {
        for (Integer value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
