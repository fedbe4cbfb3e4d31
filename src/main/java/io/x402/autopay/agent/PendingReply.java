package io.x402.autopay.agent;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.x402.autopay.model.PendingChallenge;

/** @param entry null when the id is unknown or expired */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PendingReply(PendingChallenge entry) {

    public boolean found() {
        return entry != null;
    }
}
