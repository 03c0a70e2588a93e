package com.chaintruth.domain;

import java.time.Instant;
import java.util.Optional;

/**
 * Conditional writes on chain transaction records.
 */
public interface ChainTransactionRecordRepositoryCustom {

    /**
     * Upserts a SEEN record on first observation; an existing record only gets its confirmation count raised.
     */
    void recordSeen(String networkId, String txHash, String sender, Long blockHeight, int confirmations, Instant now);

    /**
     * Claims the record for an intent while it is below threshold. Succeeds when the record is unclaimed or already
     * claimed by the same intent and not yet recorded; returns empty when another intent holds it.
     */
    Optional<ChainTransactionRecord> claimForConfirming(ChainTransactionRecord claim, Instant now);

    /**
     * Drops a CONFIRMING claim held by {@code intentId} when the intent refused the transition, so the
     * transaction is not stranded on a closed intent. Recorded claims are never released.
     */
    void releaseClaim(String key, String intentId, Instant now);
}
