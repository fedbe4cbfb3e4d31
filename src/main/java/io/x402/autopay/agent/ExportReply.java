package io.x402.autopay.agent;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Reply to an export; the only reply that ever carries key material. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExportReply(String secretMaterial, String error) {

    static ExportReply of(String secretMaterial) {
        return new ExportReply(secretMaterial, null);
    }

    static ExportReply failure(String error) {
        return new ExportReply(null, error);
    }

    @Override
    public String toString() {
        return "ExportReply{secretMaterial=" + (secretMaterial == null ? "null" : "<redacted>") + ", error=" + error + "}";
    }
}
