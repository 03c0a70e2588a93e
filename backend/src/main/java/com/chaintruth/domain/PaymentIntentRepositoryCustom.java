package com.chaintruth.domain;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Conditional status transitions on payment intents. Each method is a compare-and-set on the intent's
 * status and revision; an empty result means the intent was not in an allowed source state (or does not exist)
 * and nothing was written.
 */
public interface PaymentIntentRepositoryCustom {

    /**
     * CREATED/DETECTING → DETECTING with the named candidate. EXPIRED → DETECTING only when the intent expired after
     * {@code verificationStartedAt}.
     */
    Optional<PaymentIntent> markDetecting(String intentId, String txHash, Instant verificationStartedAt, Instant now);

    /**
     * DETECTING → CONFIRMING, or CONFIRMING → CONFIRMING for the same candidate with a higher count.
     * EXPIRED → CONFIRMING only when the intent expired after {@code verificationStartedAt}.
     */
    Optional<PaymentIntent> markConfirming(String intentId, DetectedTransfer detected, int confirmations,
                                           Instant verificationStartedAt, Instant now);

    /** DETECTING → MISMATCH, DETECTING/CONFIRMING → FAILED. */
    Optional<PaymentIntent> markFlagged(String intentId, PaymentIntentStatus target, DetectedTransfer detected,
                                        String reason, Instant now);

    /**
     * DETECTING/CONFIRMING → CONFIRMED. EXPIRED → CONFIRMED only when the intent expired after
     * {@code verificationStartedAt}.
     */
    Optional<PaymentIntent> markConfirmed(String intentId, DetectedTransfer detected, int confirmations,
                                          String donationId, Instant verificationStartedAt, Instant now);

    /** CREATED/DETECTING → EXPIRED when expiresAt has passed. */
    Optional<PaymentIntent> markExpired(String intentId, Instant now);

    /** Audit only: last rejection seen for an open intent. */
    void recordRejection(String intentId, String reason, Instant now);

    /** Moves the passive-watcher cursor forward; never backward. */
    void advanceScanCursor(String intentId, String networkId, long blockHeight);

    /** Open (CREATED/DETECTING) intents whose expiresAt is before {@code now}, oldest first. */
    List<PaymentIntent> findExpirable(Instant now, int limit);
}
