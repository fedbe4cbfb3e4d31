package io.x402.autopay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PaymentStatus {
    PENDING,
    SUCCESS,
    DENIED,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PaymentStatus fromWireName(String value) {
        return PaymentStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
