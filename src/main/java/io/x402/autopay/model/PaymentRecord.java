package io.x402.autopay.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/** One entry of the payment history. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentRecord {
    public String id;
    public String origin;
    public String endpoint;
    public double amountUsd;
    public String tokenSymbol;
    /** Epoch millis. */
    public long timestamp;
    public PaymentStatus status;
    public boolean autoApproved;
    public String txReference;
    public String note;

    /** Default constructor for Jackson. */
    public PaymentRecord() {}

    public static PaymentRecord forChallenge(ChallengeDetails challenge, PaymentStatus status,
                                             boolean autoApproved, long timestamp) {
        PaymentRecord record = new PaymentRecord();
        record.id = challenge.challengeId();
        record.origin = challenge.origin();
        record.endpoint = challenge.endpoint();
        record.amountUsd = challenge.amountUsd();
        record.tokenSymbol = challenge.tokenSymbol();
        record.timestamp = timestamp;
        record.status = status;
        record.autoApproved = autoApproved;
        return record;
    }
}
