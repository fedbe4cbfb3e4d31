package io.x402.autopay.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** EIP-3009 TransferWithAuthorization message; numeric fields are decimal strings. */
@JsonPropertyOrder({"from", "to", "value", "validAfter", "validBefore", "nonce"})
public class TransferAuthorization {
    public String from;
    public String to;
    public String value;
    public String validAfter;
    public String validBefore;
    public String nonce;       // 0x-prefixed bytes32

    /** Default constructor for Jackson. */
    public TransferAuthorization() {}

    public TransferAuthorization(String from, String to, String value,
                                 String validAfter, String validBefore, String nonce) {
        this.from = from;
        this.to = to;
        this.value = value;
        this.validAfter = validAfter;
        this.validBefore = validBefore;
        this.nonce = nonce;
    }
}
