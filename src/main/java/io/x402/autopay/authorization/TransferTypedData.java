package io.x402.autopay.authorization;

import io.x402.autopay.model.ChallengeDetails;
import io.x402.autopay.model.TransferAuthorization;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** EIP-712 document for an EIP-3009 {@code TransferWithAuthorization}. */
final class TransferTypedData {

    static final String PRIMARY_TYPE = "TransferWithAuthorization";
    static final String DEFAULT_TOKEN_NAME = "USD Coin";
    static final String DEFAULT_TOKEN_VERSION = "2";

    private TransferTypedData() {
    }

    static Map<String, Object> of(ChallengeDetails challenge, TransferAuthorization authorization) {
        Map<String, Object> types = new LinkedHashMap<>();
        types.put("EIP712Domain", List.of(
            field("name", "string"),
            field("version", "string"),
            field("chainId", "uint256"),
            field("verifyingContract", "address")));
        types.put(PRIMARY_TYPE, List.of(
            field("from", "address"),
            field("to", "address"),
            field("value", "uint256"),
            field("validAfter", "uint256"),
            field("validBefore", "uint256"),
            field("nonce", "bytes32")));

        Map<String, Object> domain = new LinkedHashMap<>();
        domain.put("name", challenge.tokenName() != null ? challenge.tokenName() : DEFAULT_TOKEN_NAME);
        domain.put("version", challenge.tokenVersion() != null ? challenge.tokenVersion() : DEFAULT_TOKEN_VERSION);
        domain.put("chainId", challenge.chainId());
        domain.put("verifyingContract", challenge.tokenAddress());

        Map<String, Object> message = new LinkedHashMap<>();
        message.put("from", authorization.from);
        message.put("to", authorization.to);
        message.put("value", authorization.value);
        message.put("validAfter", authorization.validAfter);
        message.put("validBefore", authorization.validBefore);
        message.put("nonce", authorization.nonce);

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("types", types);
        document.put("primaryType", PRIMARY_TYPE);
        document.put("domain", domain);
        document.put("message", message);
        return document;
    }

    private static Map<String, String> field(String name, String type) {
        Map<String, String> field = new LinkedHashMap<>();
        field.put("name", name);
        field.put("type", type);
        return field;
    }
}
