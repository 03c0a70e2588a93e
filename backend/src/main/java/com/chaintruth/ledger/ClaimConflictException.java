package com.chaintruth.ledger;

/**
 * The transaction key is already committed or owned by another intent. Rolls back the commit unit.
 */
public class ClaimConflictException extends RuntimeException {

    public ClaimConflictException(String key) {
        super("Transaction already claimed: " + key);
    }
}
