package io.x402.autopay.policy;

import io.x402.autopay.model.PaymentRecord;
import io.x402.autopay.model.PaymentStatus;
import io.x402.autopay.model.SitePolicy;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/** Spend counters behind the daily and lifetime caps. */
public final class SpendLedger {

    static final Duration TRAILING_WINDOW = Duration.ofHours(24);

    private SpendLedger() {
    }

    /** Sum of auto-approved, successful payments with a timestamp in the trailing 24 hours. */
    public static double autoSpentInLast24h(List<PaymentRecord> history, long nowMillis) {
        long cutoff = nowMillis - TRAILING_WINDOW.toMillis();
        double total = 0;
        for (PaymentRecord record : history) {
            if (record.status == PaymentStatus.SUCCESS && record.autoApproved && record.timestamp >= cutoff) {
                total += record.amountUsd;
            }
        }
        return total;
    }

    /** Zeroes the daily counter when the policy's reset date is not today (UTC). */
    public static void rollover(SitePolicy policy, LocalDate today) {
        String iso = today.toString();
        if (!iso.equals(policy.lastResetDate)) {
            policy.dailyUsd = 0;
            policy.lastResetDate = iso;
        }
    }

    /** Adds a signed payment to the site's daily and lifetime counters. */
    public static void recordSpend(SitePolicy policy, double amountUsd, LocalDate today) {
        rollover(policy, today);
        if (amountUsd <= 0 || !Double.isFinite(amountUsd)) {
            return;
        }
        policy.dailyUsd += amountUsd;
        policy.lifetimeUsd += amountUsd;
    }
}
