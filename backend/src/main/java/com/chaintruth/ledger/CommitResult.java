package com.chaintruth.ledger;

import com.chaintruth.domain.PaymentIntentStatus;

/**
 * Outcome of one commit call.
 */
public record CommitResult(Kind kind, String donationId, PaymentIntentStatus intentStatus) {

    public enum Kind {
        /** This call wrote the ledger entry. */
        RECORDED,
        /** The key was already committed; nothing written. */
        ALREADY_RECORDED,
        /** Another intent owns the transaction; nothing written. */
        CLAIMED_BY_OTHER,
        /** The intent can no longer be confirmed (closed, or tracking another transaction); nothing written. */
        INTENT_NOT_COMMITTABLE
    }

    public static CommitResult recorded(String donationId) {
        return new CommitResult(Kind.RECORDED, donationId, PaymentIntentStatus.CONFIRMED);
    }

    public static CommitResult alreadyRecorded(String donationId) {
        return new CommitResult(Kind.ALREADY_RECORDED, donationId, PaymentIntentStatus.CONFIRMED);
    }

    public static CommitResult claimedByOther() {
        return new CommitResult(Kind.CLAIMED_BY_OTHER, null, null);
    }

    public static CommitResult notCommittable(PaymentIntentStatus status) {
        return new CommitResult(Kind.INTENT_NOT_COMMITTABLE, null, status);
    }

    public boolean isAlreadyRecorded() {
        return kind == Kind.ALREADY_RECORDED;
    }
}
