package io.x402.autopay.policy;

/** Outcome of an autopay decision. */
public final class PolicyVerdict {

    public enum Decision {
        APPROVE,
        DEFER
    }

    /** Why a payment was not auto-approved. */
    public enum DeferReason {
        SITE_DENIED,
        OVER_THRESHOLD,
        PROMPT_REQUIRED,
        SITE_NOT_ALLOWED,
        SITE_CAP,
        DAILY_CAP
    }

    private static final PolicyVerdict APPROVED = new PolicyVerdict(Decision.APPROVE, null);

    private final Decision decision;
    private final DeferReason reason;

    private PolicyVerdict(Decision decision, DeferReason reason) {
        this.decision = decision;
        this.reason = reason;
    }

    public static PolicyVerdict approve() {
        return APPROVED;
    }

    public static PolicyVerdict defer(DeferReason reason) {
        return new PolicyVerdict(Decision.DEFER, reason);
    }

    public Decision decision() {
        return decision;
    }

    /** Null when approved. */
    public DeferReason reason() {
        return reason;
    }

    public boolean isApproved() {
        return decision == Decision.APPROVE;
    }

    @Override
    public String toString() {
        return reason == null ? decision.name() : decision + "(" + reason + ")";
    }
}
