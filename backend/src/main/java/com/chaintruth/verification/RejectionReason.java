package com.chaintruth.verification;

/**
 * Why a candidate transaction did not confirm an intent.
 */
public enum RejectionReason {
    INVALID_HASH_FORMAT(Category.INPUT),
    TRANSACTION_NOT_FOUND(Category.TRANSIENT),
    RPC_UNAVAILABLE(Category.TRANSIENT),
    WRONG_RECIPIENT(Category.STRUCTURAL),
    REPLAY_REJECTED(Category.STRUCTURAL),
    ASSET_MISMATCH(Category.STRUCTURAL),
    /** Amount differs only in the nonce digits: most likely a payment for another intent on the same address. */
    NONCE_MISMATCH(Category.STRUCTURAL),
    /** The transaction is already claimed by another intent. */
    ALREADY_CLAIMED(Category.STRUCTURAL),
    /** The intent is already tracking a different transaction. */
    CANDIDATE_CONFLICT(Category.STRUCTURAL),
    AMOUNT_MISMATCH(Category.FINANCIAL),
    ON_CHAIN_FAILURE(Category.FINANCIAL),
    ALREADY_TERMINAL(Category.TERMINAL);

    public enum Category {
        /** Rejected before any lookup; fix the input. */
        INPUT,
        /** Chain data not available yet; retry later with backoff. */
        TRANSIENT,
        /** Not valid for this intent; the intent stays open for another hash. */
        STRUCTURAL,
        /** Intent flagged MISMATCH or FAILED for human review. */
        FINANCIAL,
        /** Intent already closed. */
        TERMINAL
    }

    private final Category category;

    RejectionReason(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }

    public boolean isRetryable() {
        return category == Category.TRANSIENT;
    }
}
