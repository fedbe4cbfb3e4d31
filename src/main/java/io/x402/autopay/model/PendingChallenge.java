package io.x402.autopay.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/** A challenge waiting for a decision, with the context it was intercepted in. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PendingChallenge {
    public ChallengeDetails challenge;
    public Integer tabId;
    public Integer windowId;
    /** Epoch millis. */
    public long createdAt;

    /** Default constructor for Jackson. */
    public PendingChallenge() {}

    public PendingChallenge(ChallengeDetails challenge, Integer tabId, Integer windowId, long createdAt) {
        this.challenge = challenge;
        this.tabId = tabId;
        this.windowId = windowId;
        this.createdAt = createdAt;
    }
}
