package io.x402.autopay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Coarse activity indicator shown by UI collaborators. */
public enum AgentStatus {
    IDLE,
    PAYING,
    VERIFIED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AgentStatus fromWireName(String value) {
        return AgentStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
