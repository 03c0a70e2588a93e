package com.chaintruth.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;

/**
 * Chain facts recorded on an intent once a candidate transaction has been evaluated against it.
 */
@NoArgsConstructor
@Getter
@Setter
public class DetectedTransfer {

    private String txHash;
    private String sender;
    private String recipient;
    /** Raw amount received by the deposit address in the intent's asset. */
    private BigInteger amountRaw;
    /** Null while the transaction is in the mempool. */
    private Long blockHeight;
    private boolean succeeded;

    public DetectedTransfer(String txHash, String sender, String recipient, BigInteger amountRaw, Long blockHeight, boolean succeeded) {
        this.txHash = txHash;
        this.sender = sender;
        this.recipient = recipient;
        this.amountRaw = amountRaw;
        this.blockHeight = blockHeight;
        this.succeeded = succeeded;
    }
}
