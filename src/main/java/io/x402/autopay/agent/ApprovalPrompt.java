package io.x402.autopay.agent;

import io.x402.autopay.model.ChallengeDetails;

/**
 * Shows a challenge that was not auto-approved to a person. The answer comes back later as a
 * {@link AgentCommand.ResolvePendingChallenge} on the bus.
 */
public interface ApprovalPrompt {

    /** Prompt that shows nothing; pending challenges wait until resolved through the bus. */
    ApprovalPrompt NONE = new ApprovalPrompt() {
        @Override
        public Integer open(ChallengeDetails challenge) {
            return null;
        }

        @Override
        public void close(Integer windowId) {
        }
    };

    /**
     * @return an id for the prompt window, or null when the prompt has none
     */
    Integer open(ChallengeDetails challenge);

    /** Closes a window returned by {@link #open}; called once the challenge is resolved. */
    void close(Integer windowId);
}
