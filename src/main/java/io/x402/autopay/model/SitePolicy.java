package io.x402.autopay.model;

import java.time.LocalDate;

/** Per-origin autopay policy and spend counters. */
public class SitePolicy {
    public String origin;
    public PolicyMode mode = PolicyMode.ASK;
    public boolean allowUnderThreshold;
    /** Lifetime cap in USD; null or non-positive means no cap. */
    public Double capUsd;
    public double lifetimeUsd;
    public double dailyUsd;
    /** UTC ISO date (yyyy-MM-dd) the daily counter belongs to. */
    public String lastResetDate;

    /** Default constructor for Jackson. */
    public SitePolicy() {}

    /** Policy created the first time an origin is seen: prompts, no cap, empty counters. */
    public static SitePolicy createDefault(String origin, LocalDate today) {
        SitePolicy policy = new SitePolicy();
        policy.origin = origin;
        policy.mode = PolicyMode.ASK;
        policy.allowUnderThreshold = false;
        policy.capUsd = null;
        policy.lifetimeUsd = 0;
        policy.dailyUsd = 0;
        policy.lastResetDate = today.toString();
        return policy;
    }
}
