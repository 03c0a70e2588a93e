package com.chaintruth.domain;

import java.time.Instant;

/**
 * Audit trail entry appended to an intent on every status change.
 */
public record StatusChange(PaymentIntentStatus from, PaymentIntentStatus to, Instant at, String reason, String txHash) {
}
