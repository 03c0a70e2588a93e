package com.chaintruth.verification;

import com.chaintruth.domain.PaymentIntentStatus;

/**
 * Result of verifying one candidate transaction against one intent.
 *
 * @param donationId set for CONFIRMED and ALREADY_RECORDED
 * @param reason     set for REJECTED
 */
public record VerificationOutcome(
        Kind kind,
        String intentId,
        String txHash,
        PaymentIntentStatus intentStatus,
        String donationId,
        RejectionReason reason,
        String detail,
        Integer confirmations,
        Integer confirmationsRequired
) {

    public enum Kind {
        CONFIRMED,
        PENDING,
        ALREADY_RECORDED,
        REJECTED
    }

    public static VerificationOutcome confirmed(String intentId, String txHash, String donationId, int confirmations, int required) {
        return new VerificationOutcome(Kind.CONFIRMED, intentId, txHash, PaymentIntentStatus.CONFIRMED, donationId,
                null, null, confirmations, required);
    }

    public static VerificationOutcome pending(String intentId, String txHash, int confirmations, int required) {
        return new VerificationOutcome(Kind.PENDING, intentId, txHash, PaymentIntentStatus.CONFIRMING, null,
                null, null, confirmations, required);
    }

    public static VerificationOutcome alreadyRecorded(String intentId, String txHash, String donationId) {
        return new VerificationOutcome(Kind.ALREADY_RECORDED, intentId, txHash, PaymentIntentStatus.CONFIRMED, donationId,
                null, null, null, null);
    }

    public static VerificationOutcome rejected(String intentId, String txHash, PaymentIntentStatus status,
                                               RejectionReason reason, String detail) {
        return new VerificationOutcome(Kind.REJECTED, intentId, txHash, status, null, reason, detail, null, null);
    }

    public boolean isRejected() {
        return kind == Kind.REJECTED;
    }

    public boolean isRetryable() {
        return reason != null && reason.isRetryable();
    }
}
