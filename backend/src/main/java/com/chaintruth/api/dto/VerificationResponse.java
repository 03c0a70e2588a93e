package com.chaintruth.api.dto;

import com.chaintruth.verification.VerificationOutcome;

/**
 * Discriminated verification result: result is one of confirmed, pending, alreadyRecorded, rejected.
 */
public record VerificationResponse(
        String result,
        String intentId,
        String txHash,
        String intentStatus,
        String donationId,
        boolean alreadyRecorded,
        String reason,
        String category,
        boolean retryable,
        String detail,
        Integer confirmations,
        Integer confirmationsRequired
) {

    public static VerificationResponse from(VerificationOutcome outcome) {
        return new VerificationResponse(
                resultName(outcome.kind()),
                outcome.intentId(),
                outcome.txHash(),
                outcome.intentStatus() != null ? outcome.intentStatus().name() : null,
                outcome.donationId(),
                outcome.kind() == VerificationOutcome.Kind.ALREADY_RECORDED,
                outcome.reason() != null ? outcome.reason().name() : null,
                outcome.reason() != null ? outcome.reason().category().name() : null,
                outcome.isRetryable(),
                outcome.detail(),
                outcome.confirmations(),
                outcome.confirmationsRequired());
    }

    private static String resultName(VerificationOutcome.Kind kind) {
        return switch (kind) {
            case CONFIRMED -> "confirmed";
            case PENDING -> "pending";
            case ALREADY_RECORDED -> "alreadyRecorded";
            case REJECTED -> "rejected";
        };
    }
}
