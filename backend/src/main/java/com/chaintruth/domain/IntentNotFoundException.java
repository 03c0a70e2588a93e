package com.chaintruth.domain;

/**
 * No payment intent with the given id.
 */
public class IntentNotFoundException extends RuntimeException {

    public IntentNotFoundException(String intentId) {
        super("Payment intent not found: " + intentId);
    }
}
