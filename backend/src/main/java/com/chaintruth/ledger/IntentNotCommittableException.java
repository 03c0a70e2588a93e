package com.chaintruth.ledger;

/**
 * The intent refused the CONFIRMED transition. Rolls back the commit unit.
 */
public class IntentNotCommittableException extends RuntimeException {

    public IntentNotCommittableException(String intentId) {
        super("Intent cannot be confirmed: " + intentId);
    }
}
