package io.x402.autopay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Per-site autopay mode. */
public enum PolicyMode {
    ASK,
    DENY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PolicyMode fromWireName(String value) {
        return PolicyMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
