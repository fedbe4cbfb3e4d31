package io.x402.autopay.agent;

import io.x402.autopay.model.AgentSettings;
import io.x402.autopay.model.ChainId;

/** Partial settings change; null fields are left as they are. */
public record SettingsUpdate(
    Double thresholdUsd,
    Double dailyAutoCapUsd,
    String preferredToken,
    ChainId chain,
    Boolean promptRequired) {

    public SettingsUpdate {
        requireNonNegative(thresholdUsd, "thresholdUsd");
        requireNonNegative(dailyAutoCapUsd, "dailyAutoCapUsd");
        if (preferredToken != null && !"USDC".equals(preferredToken)) {
            throw new IllegalArgumentException("Unsupported token " + preferredToken);
        }
    }

    public static SettingsUpdate threshold(double thresholdUsd) {
        return new SettingsUpdate(thresholdUsd, null, null, null, null);
    }

    public static SettingsUpdate chain(ChainId chain) {
        return new SettingsUpdate(null, null, null, chain, null);
    }

    void applyTo(AgentSettings settings) {
        if (thresholdUsd != null) {
            settings.thresholdUsd = thresholdUsd;
        }
        if (dailyAutoCapUsd != null) {
            settings.dailyAutoCapUsd = dailyAutoCapUsd;
        }
        if (preferredToken != null) {
            settings.preferredToken = preferredToken;
        }
        if (chain != null) {
            settings.chain = chain;
        }
        if (promptRequired != null) {
            settings.promptRequired = promptRequired;
        }
    }

    private static void requireNonNegative(Double value, String name) {
        if (value != null && (value.isNaN() || value.isInfinite() || value < 0)) {
            throw new IllegalArgumentException(name + " must be a non-negative number");
        }
    }
}
