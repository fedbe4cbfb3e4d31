package io.x402.autopay.model;

/** Global autopay settings. */
public class AgentSettings {
    public static final double DEFAULT_THRESHOLD_USD = 0.05;
    public static final double DEFAULT_DAILY_AUTO_CAP_USD = 1.0;

    /** Largest single payment that may be approved without a prompt. */
    public double thresholdUsd = DEFAULT_THRESHOLD_USD;

    /** Trailing 24h cap on auto-approved spend; 0 disables the cap. */
    public double dailyAutoCapUsd = DEFAULT_DAILY_AUTO_CAP_USD;

    public String preferredToken = "USDC";

    public ChainId chain = ChainId.POLYGON_AMOY;

    /** When set, every payment goes through the prompt. */
    public boolean promptRequired;

    public AgentSettings() {}

    public AgentSettings copy() {
        AgentSettings copy = new AgentSettings();
        copy.thresholdUsd = thresholdUsd;
        copy.dailyAutoCapUsd = dailyAutoCapUsd;
        copy.preferredToken = preferredToken;
        copy.chain = chain;
        copy.promptRequired = promptRequired;
        return copy;
    }
}
