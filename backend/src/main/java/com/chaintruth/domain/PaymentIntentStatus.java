package com.chaintruth.domain;

/**
 * Payment intent lifecycle. CONFIRMED, EXPIRED, FAILED and MISMATCH are terminal.
 */
public enum PaymentIntentStatus {
    CREATED,
    DETECTING,
    CONFIRMING,
    CONFIRMED,
    EXPIRED,
    FAILED,
    MISMATCH;

    public boolean isTerminal() {
        return this == CONFIRMED || this == EXPIRED || this == FAILED || this == MISMATCH;
    }
}
