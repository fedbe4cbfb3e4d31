package io.x402.autopay.agent;

import io.x402.autopay.model.PolicyMode;
import io.x402.autopay.model.SitePolicy;

/**
 * Partial change to one origin's policy; null fields are left as they are.
 *
 * @param capUsd   new lifetime cap
 * @param clearCap removes the lifetime cap, taking precedence over {@code capUsd}
 */
public record PolicyUpdate(PolicyMode mode, Boolean allowUnderThreshold, Double capUsd, boolean clearCap) {

    public PolicyUpdate {
        if (capUsd != null && (capUsd.isNaN() || capUsd < 0)) {
            throw new IllegalArgumentException("capUsd must be a non-negative number");
        }
    }

    public static PolicyUpdate mode(PolicyMode mode) {
        return new PolicyUpdate(mode, null, null, false);
    }

    public static PolicyUpdate allowUnderThreshold(boolean allow) {
        return new PolicyUpdate(null, allow, null, false);
    }

    public static PolicyUpdate cap(double capUsd) {
        return new PolicyUpdate(null, null, capUsd, false);
    }

    void applyTo(SitePolicy policy) {
        if (mode != null) {
            policy.mode = mode;
        }
        if (allowUnderThreshold != null) {
            policy.allowUnderThreshold = allowUnderThreshold;
        }
        if (clearCap) {
            policy.capUsd = null;
        } else if (capUsd != null) {
            policy.capUsd = capUsd;
        }
    }
}
