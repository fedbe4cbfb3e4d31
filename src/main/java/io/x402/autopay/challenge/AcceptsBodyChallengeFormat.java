package io.x402.autopay.challenge;

import io.x402.autopay.model.ChallengeDetails;

import java.util.Locale;
import java.util.Optional;

/** JSON 402 body with an x402 "accepts" array. */
final class AcceptsBodyChallengeFormat implements ChallengeFormat {

    @Override
    public Optional<ChallengeDetails> parse(ParseInput input) {
        if (input.body() == null || input.body().isBlank()) {
            return Optional.empty();
        }
        String contentType = input.headers().get("content-type").orElse("").toLowerCase(Locale.ROOT);
        if (!contentType.contains("application/json")) {
            return Optional.empty();
        }
        return ChallengeValues.readObject(input.body())
            .filter(AcceptsChallenge::hasAccepts)
            .flatMap(root -> AcceptsChallenge.from(root, input));
    }
}
