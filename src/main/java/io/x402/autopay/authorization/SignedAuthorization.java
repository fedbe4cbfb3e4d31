package io.x402.autopay.authorization;

import io.x402.autopay.model.PaymentPayload;

/**
 * A signed payment ready to be attached to the retried request.
 *
 * @param paymentId   value for the X-PAYMENT-ID header; equals the challenge id
 * @param headerValue base64 JSON value for the X-PAYMENT header
 * @param payload     the structure encoded into {@code headerValue}
 */
public record SignedAuthorization(String paymentId, String headerValue, PaymentPayload payload) {
}
