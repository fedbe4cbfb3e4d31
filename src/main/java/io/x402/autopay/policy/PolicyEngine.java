package io.x402.autopay.policy;

import io.x402.autopay.model.AgentSettings;
import io.x402.autopay.model.ChallengeDetails;
import io.x402.autopay.model.PaymentRecord;
import io.x402.autopay.model.PolicyMode;
import io.x402.autopay.model.SitePolicy;

import java.time.Clock;
import java.util.List;

/**
 * Decides whether a challenge may be paid without asking. Pure: the caller updates spend
 * counters after a payment is signed.
 *
 * <p>Thresholds and caps compare against the challenge's advisory USD figure, which the
 * resource server supplies or the parser estimates from the atomic amount.</p>
 */
public class PolicyEngine {

    private final Clock clock;

    public PolicyEngine(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param settings  global settings
     * @param policy    the origin's policy, or null when the origin has none
     * @param history   payment history, any order
     * @param challenge the challenge to pay
     */
    public PolicyVerdict decide(AgentSettings settings, SitePolicy policy, List<PaymentRecord> history,
                                ChallengeDetails challenge) {
        double amount = challenge.amountUsd();
        if (policy != null && policy.mode == PolicyMode.DENY) {
            return PolicyVerdict.defer(PolicyVerdict.DeferReason.SITE_DENIED);
        }
        if (amount > settings.thresholdUsd) {
            return PolicyVerdict.defer(PolicyVerdict.DeferReason.OVER_THRESHOLD);
        }
        if (settings.promptRequired) {
            return PolicyVerdict.defer(PolicyVerdict.DeferReason.PROMPT_REQUIRED);
        }
        if (policy != null && !policy.allowUnderThreshold) {
            return PolicyVerdict.defer(PolicyVerdict.DeferReason.SITE_NOT_ALLOWED);
        }
        if (policy != null && policy.capUsd != null && policy.capUsd > 0
            && policy.lifetimeUsd + amount > policy.capUsd) {
            return PolicyVerdict.defer(PolicyVerdict.DeferReason.SITE_CAP);
        }
        double dailyCap = settings.dailyAutoCapUsd;
        if (dailyCap > 0 && SpendLedger.autoSpentInLast24h(history, clock.millis()) + amount > dailyCap) {
            return PolicyVerdict.defer(PolicyVerdict.DeferReason.DAILY_CAP);
        }
        return PolicyVerdict.approve();
    }
}
