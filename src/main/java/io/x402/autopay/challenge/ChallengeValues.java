package io.x402.autopay.challenge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.x402.autopay.internal.Json;
import io.x402.autopay.model.ChainId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Keys;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/** Value normalization shared by the challenge formats. */
final class ChallengeValues {

    private static final Logger LOG = LoggerFactory.getLogger(ChallengeValues.class);

    static final int DEFAULT_DECIMALS = 6;
    static final long DEFAULT_CHAIN_ID = 137L;
    static final String DEFAULT_TOKEN = "USDC";
    /** uint8 decimals, capped at the digits of a uint256. */
    static final int MAX_DECIMALS = 77;

    private static final Pattern BASE64 = Pattern.compile("^[A-Za-z0-9+/=]+$");
    private static final Pattern BASE64_URL = Pattern.compile("^[A-Za-z0-9_=-]+$");
    private static final Pattern HEX_AMOUNT = Pattern.compile("^0[xX][0-9a-fA-F]+$");
    private static final Pattern DECIMAL_AMOUNT = Pattern.compile("^[0-9]+$");
    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private ChallengeValues() {
    }

    /**
     * Reads a header value as a JSON object, first verbatim and then base64-decoded.
     */
    static Optional<JsonNode> jsonObject(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        List<String> attempts = new ArrayList<>();
        attempts.add(trimmed);
        decodeBase64(trimmed).ifPresent(attempts::add);
        for (String attempt : attempts) {
            Optional<JsonNode> node = readObject(attempt);
            if (node.isPresent()) {
                return node;
            }
        }
        return Optional.empty();
    }

    static Optional<String> decodeBase64(String value) {
        Base64.Decoder decoder;
        if (BASE64.matcher(value).matches()) {
            decoder = Base64.getDecoder();
        } else if (BASE64_URL.matcher(value).matches()) {
            decoder = Base64.getUrlDecoder();
        } else {
            return Optional.empty();
        }
        try {
            return Optional.of(new String(decoder.decode(value), StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            LOG.debug("Value looked like base64 but did not decode: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static Optional<JsonNode> readObject(String text) {
        String trimmed = text.trim();
        if (!trimmed.startsWith("{")) {
            return Optional.empty();
        }
        try {
            JsonNode node = Json.mapper().readTree(trimmed);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            LOG.debug("Challenge candidate is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /** Normalizes a decimal, hex or numeric amount into a base-10 integer string. */
    static Optional<String> atomicAmount(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Optional.empty();
        }
        if (node.isIntegralNumber()) {
            BigInteger value = node.bigIntegerValue();
            return value.signum() < 0 ? Optional.empty() : Optional.of(value.toString());
        }
        if (node.isNumber()) {
            BigDecimal value = node.decimalValue();
            if (value.signum() < 0 || value.stripTrailingZeros().scale() > 0) {
                return Optional.empty();
            }
            return Optional.of(value.toBigInteger().toString());
        }
        return node.isTextual() ? atomicAmount(node.asText()) : Optional.empty();
    }

    static Optional<String> atomicAmount(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        if (HEX_AMOUNT.matcher(trimmed).matches()) {
            return Optional.of(new BigInteger(trimmed.substring(2), 16).toString());
        }
        if (DECIMAL_AMOUNT.matcher(trimmed).matches()) {
            return Optional.of(new BigInteger(trimmed).toString());
        }
        return Optional.empty();
    }

    /** 20-byte hex address; mixed-case input must carry a valid EIP-55 checksum. */
    static boolean isAddress(String value) {
        if (value == null || !ADDRESS.matcher(value).matches()) {
            return false;
        }
        String hex = value.substring(2);
        if (hex.equals(hex.toLowerCase(Locale.ROOT)) || hex.equals(hex.toUpperCase(Locale.ROOT))) {
            return true;
        }
        return Keys.toChecksumAddress(value).equals(value);
    }

    /** Advisory USD figure: atomic amount scaled by the token decimals. */
    static double estimateUsd(String amountAtomic, Integer decimals) {
        int scale = isDecimals(decimals) ? decimals : DEFAULT_DECIMALS;
        return new BigDecimal(amountAtomic).movePointLeft(scale).doubleValue();
    }

    static boolean isDecimals(Integer decimals) {
        return decimals != null && decimals >= 0 && decimals <= MAX_DECIMALS;
    }

    /** Token decimals in [0, 77]; anything else counts as absent. */
    static Optional<Integer> decimals(JsonNode node) {
        return integer(node).filter(ChallengeValues::isDecimals);
    }

    /** A USD figure the policy can compare against: finite and not negative. */
    static boolean isUsdAmount(Double value) {
        return value != null && Double.isFinite(value) && value >= 0;
    }

    static Optional<Double> number(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Optional.empty();
        }
        if (node.isNumber()) {
            return finite(node.doubleValue());
        }
        return node.isTextual() ? number(node.asText()) : Optional.empty();
    }

    static Optional<Double> number(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return finite(Double.parseDouble(raw.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Double> finite(double value) {
        return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
    }

    static Optional<Integer> integer(JsonNode node) {
        return number(node)
            .filter(value -> value == Math.rint(value))
            .map(Double::intValue);
    }

    static String text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }

    static JsonNode firstPresent(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    /**
     * Chain id from a network descriptor: "eip155:80002", "80002" or a known network name.
     */
    static OptionalLong chainFromNetwork(String network) {
        if (network == null || network.isBlank()) {
            return OptionalLong.empty();
        }
        String trimmed = network.trim();
        int colon = trimmed.lastIndexOf(':');
        String candidate = colon >= 0 ? trimmed.substring(colon + 1) : trimmed;
        try {
            long value = Long.parseLong(candidate);
            return value > 0 ? OptionalLong.of(value) : OptionalLong.empty();
        } catch (NumberFormatException e) {
            String lowered = trimmed.toLowerCase(Locale.ROOT);
            for (ChainId chain : ChainId.values()) {
                if (chain.canonicalNetwork().equals(lowered) || chain.key().equalsIgnoreCase(lowered)) {
                    return OptionalLong.of(chain.chainId());
                }
            }
            return OptionalLong.empty();
        }
    }

    static OptionalLong chainId(JsonNode node) {
        return number(node)
            .filter(value -> value > 0 && value == Math.rint(value))
            .map(value -> OptionalLong.of(value.longValue()))
            .orElse(OptionalLong.empty());
    }

    static String tokenSymbol(String raw) {
        return raw == null || raw.isBlank() ? DEFAULT_TOKEN : raw.trim().toUpperCase(Locale.ROOT);
    }
}
