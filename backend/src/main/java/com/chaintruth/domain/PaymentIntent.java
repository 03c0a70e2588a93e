package com.chaintruth.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One pledge to pay an exact asset amount on one network before {@link #expiresAt}.
 * Expectation fields are fixed at creation; status and detection fields move only through
 * {@link PaymentIntentRepositoryCustom} conditional updates.
 */
@Document(collection = "payment_intents")
@CompoundIndexes({
    @CompoundIndex(name = "status_expires", def = "{'status': 1, 'expiresAt': 1}"),
    @CompoundIndex(name = "network_address_status", def = "{'networkId': 1, 'depositAddress': 1, 'status': 1}"),
    @CompoundIndex(name = "campaign_created", def = "{'campaignId': 1, 'createdAt': -1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PaymentIntent {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String campaignId;
    /** Null for anonymous donors. */
    private String donorRef;
    private String networkId;
    private String assetId;
    private int decimals;
    /** Amount the donor asked for, before the nonce. */
    private String requestedAmountNative;
    /** Nonced amount the donor must send, as a display decimal. */
    private String expectedAmountNative;
    /** Nonced amount in native units; matched exactly. */
    private BigInteger expectedAmountRaw;
    private int nonceWidth;
    private BigDecimal amountUsd;
    private BigDecimal fxRate;
    private String depositAddress;
    /** Replay guard: chain height when the intent was created. */
    private long startBlock;
    private Instant expiresAt;
    private String paymentUri;

    private PaymentIntentStatus status;
    /** Candidate tx most recently associated with the intent. */
    private String candidateTxHash;
    private DetectedTransfer detected;
    private Integer confirmations;
    private String confirmedTxHash;
    private String donationId;
    private String lastRejectionReason;
    /** Scanning cursor for passive watchers, per network. */
    private Map<String, Long> lastScannedBlockByNetwork = new HashMap<>();
    private List<StatusChange> statusHistory = new ArrayList<>();

    /** Incremented by every conditional update; the compare-and-set token for transitions. */
    private long revision;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant confirmedAt;
    private Instant expiredAt;
}
