package com.chaintruth.verification;

/**
 * Who named the candidate transaction.
 */
public enum VerificationMode {
    /** A donor or operator submitted the hash for one intent. Failures are recorded against the intent. */
    MANUAL,
    /**
     * A watcher or the re-poll job proposed the hash. A non-matching candidate leaves the intent untouched,
     * since the same transaction is usually offered to every open intent on the address.
     */
    PASSIVE
}
