package io.x402.autopay;

/**
 * Base exception thrown by the payment agent for failures a caller is expected to handle.
 */
public class PaymentAgentException extends Exception {

    private static final long serialVersionUID = 1L;

    public PaymentAgentException(String message) {
        super(message);
    }

    public PaymentAgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
