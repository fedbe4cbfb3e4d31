package io.x402.autopay.settlement;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.x402.autopay.internal.Json;
import io.x402.autopay.model.SettlementResponseHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decodes an X-PAYMENT-RESPONSE header value. Tried in order: a JSON object, base64 of a JSON
 * object, and a compact token (three or more dot-separated segments), bare or base64-wrapped.
 */
public final class SettlementDecoder {

    private static final Logger LOG = LoggerFactory.getLogger(SettlementDecoder.class);

    private static final Pattern BASE64 = Pattern.compile("^[A-Za-z0-9+/_-]+={0,2}$");

    private final ObjectMapper mapper = Json.mapper();

    public Optional<SettlementReceipt> decode(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String raw = value.trim();

        Optional<SettlementReceipt> direct = fromJson(raw);
        if (direct.isPresent()) {
            return direct;
        }

        if (BASE64.matcher(raw).matches()) {
            String decoded = decodeBase64(raw);
            if (decoded != null) {
                Optional<SettlementReceipt> wrapped = fromJson(decoded.trim());
                if (wrapped.isPresent()) {
                    return wrapped;
                }
                if (isCompactToken(decoded.trim())) {
                    return Optional.of(SettlementReceipt.tokenOnly(decoded.trim()));
                }
            }
        }

        if (isCompactToken(raw)) {
            return Optional.of(SettlementReceipt.tokenOnly(raw));
        }
        LOG.debug("Unrecognized settlement header ({} chars)", raw.length());
        return Optional.empty();
    }

    private Optional<SettlementReceipt> fromJson(String text) {
        if (!text.startsWith("{")) {
            return Optional.empty();
        }
        try {
            JsonNode node = mapper.readTree(text);
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            return Optional.of(SettlementReceipt.of(mapper.treeToValue(node, SettlementResponseHeader.class)));
        } catch (JsonProcessingException e) {
            LOG.debug("Settlement header is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static String decodeBase64(String value) {
        try {
            return new String(Base64.getDecoder().decode(value), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException standard) {
            try {
                return new String(Base64.getUrlDecoder().decode(value), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException urlSafe) {
                return null;
            }
        }
    }

    static boolean isCompactToken(String value) {
        if (value.isEmpty() || Character.isWhitespace(value.charAt(0))) {
            return false;
        }
        String[] segments = value.split("\\.", -1);
        if (segments.length < 3) {
            return false;
        }
        for (String segment : segments) {
            for (int i = 0; i < segment.length(); i++) {
                if (Character.isWhitespace(segment.charAt(i)) || Character.isISOControl(segment.charAt(i))) {
                    return false;
                }
            }
        }
        return true;
    }
}
