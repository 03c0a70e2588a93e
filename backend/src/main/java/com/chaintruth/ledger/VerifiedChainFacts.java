package com.chaintruth.ledger;

import com.chaintruth.domain.DetectedTransfer;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Chain facts that passed every verification check, handed to the committer.
 *
 * @param verificationStartedAt lets an intent that expired mid-verification still be confirmed
 */
public record VerifiedChainFacts(
        String sender,
        String recipient,
        BigInteger amountRaw,
        Long blockHeight,
        int confirmations,
        String explorerUrl,
        Instant verificationStartedAt
) {

    public DetectedTransfer toDetected(String txHash) {
        return new DetectedTransfer(txHash, sender, recipient, amountRaw, blockHeight, true);
    }
}
