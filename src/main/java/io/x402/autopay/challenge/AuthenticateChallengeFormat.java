package io.x402.autopay.challenge;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.x402.autopay.internal.Json;
import io.x402.autopay.model.ChallengeDetails;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code WWW-Authenticate: x402 key=value, key="value"}. A challenge/payload parameter is
 * decoded like the dedicated header; otherwise the parameters themselves describe the payment.
 */
final class AuthenticateChallengeFormat implements ChallengeFormat {

    private static final Pattern SCHEME = Pattern.compile("^\\s*(x-?402)\\s+(.+)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern PARAM = Pattern.compile("\\s*([a-zA-Z0-9_-]+)=((\"[^\"]*\")|([^,]+))");

    @Override
    public Optional<ChallengeDetails> parse(ParseInput input) {
        Optional<String> header = input.headers().get("www-authenticate");
        if (header.isEmpty()) {
            return Optional.empty();
        }
        Matcher scheme = SCHEME.matcher(header.get());
        if (!scheme.matches()) {
            return Optional.empty();
        }
        Map<String, String> params = parameters(scheme.group(2));

        String embedded = first(params, "challenge", "payload");
        if (embedded != null) {
            Optional<ChallengeDetails> parsed = JsonChallengeFormat.fromValue(embedded, input);
            if (parsed.isPresent()) {
                return parsed;
            }
        }

        String seller = first(params, "seller", "to");
        String tokenAddress = first(params, "tokenAddress", "token_address", "contract");
        Optional<String> atomic = ChallengeValues.atomicAmount(first(params, "amountAtomic", "amount_atomic", "amount"));
        if (atomic.isEmpty() || !ChallengeValues.isAddress(seller) || !ChallengeValues.isAddress(tokenAddress)) {
            return Optional.empty();
        }
        long chainId = ChallengeValues.number(first(params, "chainId", "chain_id", "chain"))
            .filter(value -> value > 0 && value == Math.rint(value))
            .map(Double::longValue)
            .orElse(ChallengeValues.DEFAULT_CHAIN_ID);
        double amountUsd = ChallengeValues.number(first(params, "amountUsd", "amount_usd", "price", "cost"))
            .filter(ChallengeValues::isUsdAmount)
            .orElseGet(() -> ChallengeValues.estimateUsd(atomic.get(), null));
        String id = first(params, "id");

        ObjectNode raw = Json.mapper().createObjectNode();
        params.forEach(raw::put);

        return Optional.of(ChallengeDetails.builder()
            .challengeId(id != null ? id : input.fallbackId())
            .origin(input.context().origin())
            .endpoint(input.context().endpoint())
            .method(input.context().method())
            .amountUsd(amountUsd)
            .tokenSymbol(ChallengeValues.tokenSymbol(first(params, "token", "tokenSymbol", "token_symbol")))
            .chainId(chainId)
            .tokenAddress(tokenAddress)
            .seller(seller)
            .amountAtomic(atomic.get())
            .rawHeaders(input.headers().asMap())
            .rawChallenge(raw)
            .build());
    }

    static Map<String, String> parameters(String paramsPart) {
        Map<String, String> params = new LinkedHashMap<>();
        Matcher matcher = PARAM.matcher(paramsPart);
        while (matcher.find()) {
            String raw = matcher.group(3) != null ? matcher.group(3) : matcher.group(4);
            params.put(matcher.group(1), stripQuotes(raw.trim()));
        }
        return params;
    }

    private static String stripQuotes(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static String first(Map<String, String> params, String... keys) {
        for (String key : keys) {
            String value = params.get(key);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
