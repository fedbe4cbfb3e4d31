package io.x402.autopay.challenge;

import java.net.http.HttpHeaders;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Case-insensitive, single-valued view of response headers. */
public final class ResponseHeaders {

    private final Map<String, String> values;

    private ResponseHeaders(Map<String, String> values) {
        this.values = values;
    }

    public static ResponseHeaders of(Map<String, String> headers) {
        Map<String, String> lowered = new LinkedHashMap<>();
        headers.forEach((name, value) -> {
            if (name != null && value != null) {
                lowered.put(name.toLowerCase(Locale.ROOT), value);
            }
        });
        return new ResponseHeaders(Collections.unmodifiableMap(lowered));
    }

    public static ResponseHeaders of(HttpHeaders headers) {
        Map<String, String> lowered = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : headers.map().entrySet()) {
            if (entry.getKey() != null && !entry.getValue().isEmpty()) {
                lowered.put(entry.getKey().toLowerCase(Locale.ROOT), String.join(", ", entry.getValue()));
            }
        }
        return new ResponseHeaders(Collections.unmodifiableMap(lowered));
    }

    public Optional<String> get(String name) {
        return Optional.ofNullable(values.get(name.toLowerCase(Locale.ROOT)));
    }

    /** First non-blank value among the given names, in order. */
    public Optional<String> first(String... names) {
        for (String name : names) {
            String value = values.get(name.toLowerCase(Locale.ROOT));
            if (value != null && !value.isBlank()) {
                return Optional.of(value.trim());
            }
        }
        return Optional.empty();
    }

    /** Lower-cased header map. */
    public Map<String, String> asMap() {
        return values;
    }
}
