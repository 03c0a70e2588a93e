package com.chaintruth.domain;

/**
 * Observation state of a chain transaction record.
 */
public enum ChainTransactionStatus {
    /** Fetched at least once; not claimed by any intent. */
    SEEN,
    /** Claimed by an intent, below the confirmation threshold. */
    CONFIRMING,
    /** Claimed and committed to the donation ledger. */
    CONFIRMED
}
