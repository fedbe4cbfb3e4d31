package io.x402.autopay.agent;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Outcome of resolving a pending challenge from the prompt. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DecisionResult(Status status, String message) {

    public enum Status {
        SUCCESS,
        DENIED,
        LOCKED,
        ERROR;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    static DecisionResult success() {
        return new DecisionResult(Status.SUCCESS, null);
    }

    static DecisionResult denied() {
        return new DecisionResult(Status.DENIED, null);
    }

    static DecisionResult locked() {
        return new DecisionResult(Status.LOCKED, "Wallet locked");
    }

    static DecisionResult error(String message) {
        return new DecisionResult(Status.ERROR, message);
    }
}
