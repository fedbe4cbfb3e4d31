package io.x402.autopay.challenge;

import io.x402.autopay.model.ChallengeDetails;

import java.util.Optional;

/**
 * One encoding a resource server may use to describe a payment challenge.
 * An encoding that does not match yields empty; it never throws for malformed input.
 */
public interface ChallengeFormat {

    Optional<ChallengeDetails> parse(ParseInput input);

    /**
     * Everything a format may look at.
     *
     * @param headers    response headers
     * @param body       response body, or null when not read
     * @param context    the request that produced the response
     * @param fallbackId id to use when the challenge carries none
     */
    record ParseInput(ResponseHeaders headers, String body, RequestContext context, String fallbackId) {
    }
}
