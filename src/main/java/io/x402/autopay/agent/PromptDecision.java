package io.x402.autopay.agent;

/**
 * Answer given at the approval prompt.
 *
 * @param alwaysAllow on approval, let later under-threshold challenges from the origin pay without asking
 */
public record PromptDecision(boolean approve, boolean alwaysAllow) {

    public static PromptDecision approveOnce() {
        return new PromptDecision(true, false);
    }

    public static PromptDecision deny() {
        return new PromptDecision(false, false);
    }
}
