package io.x402.autopay.agent;

/** Receives the outcome of challenges resolved at the prompt. */
@FunctionalInterface
public interface ResolutionListener {

    void onResolution(String challengeId, ChallengeResolution resolution);
}
