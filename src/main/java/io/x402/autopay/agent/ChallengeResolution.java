package io.x402.autopay.agent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * What the interceptor should do with a 402 response.
 *
 * @param retryHeaders headers to add to the retried request, present for {@link Action#RETRY}
 * @param challengeId  id to wait on, present for {@link Action#PENDING}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChallengeResolution(Action action, Map<String, String> retryHeaders, String challengeId, String message) {

    public static final String HEADER_PAYMENT = "X-PAYMENT";
    public static final String HEADER_PAYMENT_ID = "X-PAYMENT-ID";

    public enum Action {
        RETRY,
        DENY,
        ERROR,
        PENDING;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Action fromWireName(String value) {
            return Action.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public static ChallengeResolution retry(String paymentHeader, String paymentId) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HEADER_PAYMENT, paymentHeader);
        headers.put(HEADER_PAYMENT_ID, paymentId);
        return new ChallengeResolution(Action.RETRY, Map.copyOf(headers), paymentId, null);
    }

    public static ChallengeResolution pending(String challengeId) {
        return new ChallengeResolution(Action.PENDING, null, challengeId, null);
    }

    public static ChallengeResolution deny(String challengeId) {
        return new ChallengeResolution(Action.DENY, null, challengeId, null);
    }

    public static ChallengeResolution error(String message) {
        return new ChallengeResolution(Action.ERROR, null, null, message);
    }
}
