package io.x402.autopay.config;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap the payment agent and its interceptor.
 */
public final class AgentConfig {

    public static final Duration DEFAULT_BUS_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_PENDING_CHALLENGE_TTL = Duration.ofMinutes(10);
    public static final Duration DEFAULT_SETTLEMENT_TOKEN_TTL = Duration.ofMinutes(5);
    public static final Duration DEFAULT_APPROVAL_TIMEOUT = Duration.ofMinutes(5);
    public static final Duration DEFAULT_BALANCE_REFRESH_INTERVAL = Duration.ofHours(1);
    public static final int DEFAULT_HISTORY_LIMIT = 2000;
    public static final int DEFAULT_LOCK_MINUTES = 15;
    public static final int MIN_LOCK_MINUTES = 1;
    public static final int MAX_LOCK_MINUTES = 1440;
    public static final int DEFAULT_KEY_DERIVATION_ITERATIONS = 150_000;

    private final Duration busTimeout;
    private final Duration pendingChallengeTtl;
    private final Duration settlementTokenTtl;
    private final Duration approvalTimeout;
    private final Duration balanceRefreshInterval;
    private final int historyLimit;
    private final int defaultLockMinutes;
    private final int keyDerivationIterations;
    private final Clock clock;
    private final Path stateFile;

    private AgentConfig(Builder builder) {
        this.busTimeout = builder.busTimeout;
        this.pendingChallengeTtl = builder.pendingChallengeTtl;
        this.settlementTokenTtl = builder.settlementTokenTtl;
        this.approvalTimeout = builder.approvalTimeout;
        this.balanceRefreshInterval = builder.balanceRefreshInterval;
        this.historyLimit = builder.historyLimit;
        this.defaultLockMinutes = builder.defaultLockMinutes;
        this.keyDerivationIterations = builder.keyDerivationIterations;
        this.clock = builder.clock;
        this.stateFile = builder.stateFile;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AgentConfig defaults() {
        return builder().build();
    }

    public AgentConfig withDefaults() {
        if (historyLimit < 0) {
            throw new IllegalArgumentException("HistoryLimit cannot be negative");
        }
        if (keyDerivationIterations < 0) {
            throw new IllegalArgumentException("KeyDerivationIterations cannot be negative");
        }
        int resolvedLockMinutes = defaultLockMinutes == 0 ? DEFAULT_LOCK_MINUTES : clampLockMinutes(defaultLockMinutes);

        return new Builder()
            .busTimeout(positiveOr(busTimeout, DEFAULT_BUS_TIMEOUT))
            .pendingChallengeTtl(positiveOr(pendingChallengeTtl, DEFAULT_PENDING_CHALLENGE_TTL))
            .settlementTokenTtl(positiveOr(settlementTokenTtl, DEFAULT_SETTLEMENT_TOKEN_TTL))
            .approvalTimeout(positiveOr(approvalTimeout, DEFAULT_APPROVAL_TIMEOUT))
            .balanceRefreshInterval(positiveOr(balanceRefreshInterval, DEFAULT_BALANCE_REFRESH_INTERVAL))
            .historyLimit(historyLimit == 0 ? DEFAULT_HISTORY_LIMIT : historyLimit)
            .defaultLockMinutes(resolvedLockMinutes)
            .keyDerivationIterations(keyDerivationIterations == 0 ? DEFAULT_KEY_DERIVATION_ITERATIONS : keyDerivationIterations)
            .clock(Optional.ofNullable(clock).orElse(Clock.systemUTC()))
            .stateFile(stateFile)
            .buildInternal();
    }

    /** Clamps a requested unlock duration into [1, 1440] minutes. */
    public static int clampLockMinutes(int minutes) {
        return Math.min(Math.max(minutes, MIN_LOCK_MINUTES), MAX_LOCK_MINUTES);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        if (value == null || value.isNegative() || value.isZero()) {
            return fallback;
        }
        return value;
    }

    public Duration getBusTimeout() {
        return busTimeout;
    }

    public Duration getPendingChallengeTtl() {
        return pendingChallengeTtl;
    }

    public Duration getSettlementTokenTtl() {
        return settlementTokenTtl;
    }

    public Duration getApprovalTimeout() {
        return approvalTimeout;
    }

    public Duration getBalanceRefreshInterval() {
        return balanceRefreshInterval;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public int getDefaultLockMinutes() {
        return defaultLockMinutes;
    }

    public int getKeyDerivationIterations() {
        return keyDerivationIterations;
    }

    public Clock getClock() {
        return clock;
    }

    /** Location of the persisted state document; null keeps state in memory. */
    public Path getStateFile() {
        return stateFile;
    }

    public static final class Builder {
        private Duration busTimeout;
        private Duration pendingChallengeTtl;
        private Duration settlementTokenTtl;
        private Duration approvalTimeout;
        private Duration balanceRefreshInterval;
        private int historyLimit;
        private int defaultLockMinutes;
        private int keyDerivationIterations;
        private Clock clock;
        private Path stateFile;

        public Builder busTimeout(Duration busTimeout) {
            this.busTimeout = busTimeout;
            return this;
        }

        public Builder pendingChallengeTtl(Duration pendingChallengeTtl) {
            this.pendingChallengeTtl = pendingChallengeTtl;
            return this;
        }

        public Builder settlementTokenTtl(Duration settlementTokenTtl) {
            this.settlementTokenTtl = settlementTokenTtl;
            return this;
        }

        public Builder approvalTimeout(Duration approvalTimeout) {
            this.approvalTimeout = approvalTimeout;
            return this;
        }

        public Builder balanceRefreshInterval(Duration balanceRefreshInterval) {
            this.balanceRefreshInterval = balanceRefreshInterval;
            return this;
        }

        public Builder historyLimit(int historyLimit) {
            this.historyLimit = historyLimit;
            return this;
        }

        public Builder defaultLockMinutes(int defaultLockMinutes) {
            this.defaultLockMinutes = defaultLockMinutes;
            return this;
        }

        public Builder keyDerivationIterations(int keyDerivationIterations) {
            this.keyDerivationIterations = keyDerivationIterations;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder stateFile(Path stateFile) {
            this.stateFile = stateFile;
            return this;
        }

        public AgentConfig build() {
            return new AgentConfig(this).withDefaults();
        }

        private AgentConfig buildInternal() {
            return new AgentConfig(this);
        }
    }
}
