package io.x402.autopay.policy;

import io.x402.autopay.model.SitePolicy;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class SpendLedgerTest {

    @Test
    void spendAddsToDailyAndLifetime() {
        LocalDate today = LocalDate.of(2025, 3, 1);
        SitePolicy policy = SitePolicy.createDefault("https://a.example", today);

        SpendLedger.recordSpend(policy, 0.02, today);
        SpendLedger.recordSpend(policy, 0.03, today);

        assertEquals(0.05, policy.dailyUsd, 1e-9);
        assertEquals(0.05, policy.lifetimeUsd, 1e-9);
    }

    @Test
    void dailyCounterRollsOverOnNewUtcDate() {
        SitePolicy policy = SitePolicy.createDefault("https://a.example", LocalDate.of(2025, 3, 1));
        SpendLedger.recordSpend(policy, 0.04, LocalDate.of(2025, 3, 1));

        SpendLedger.recordSpend(policy, 0.01, LocalDate.of(2025, 3, 2));

        assertEquals(0.01, policy.dailyUsd, 1e-9);
        assertEquals(0.05, policy.lifetimeUsd, 1e-9);
        assertEquals("2025-03-02", policy.lastResetDate);
    }

    @Test
    void lifetimeNeverDecreases() {
        LocalDate today = LocalDate.of(2025, 3, 1);
        SitePolicy policy = SitePolicy.createDefault("https://a.example", today);
        SpendLedger.recordSpend(policy, 0.04, today);

        SpendLedger.recordSpend(policy, -1.0, today);
        SpendLedger.recordSpend(policy, Double.NaN, today);

        assertEquals(0.04, policy.lifetimeUsd, 1e-9);
    }
}
