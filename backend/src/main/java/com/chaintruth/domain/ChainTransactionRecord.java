package com.chaintruth.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Normalized facts about one transaction on one network. The id is the idempotency key
 * {@code networkId:txHash}; once {@link #intentId} is set it never changes.
 */
@Document(collection = "chain_transactions")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ChainTransactionRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String networkId;
    private String txHash;
    private String sender;
    private String recipient;
    private String assetId;
    private BigInteger amountRaw;
    private Integer decimals;
    private Long blockHeight;
    /** Only increases. */
    private Integer confirmations;
    private ChainTransactionStatus status;
    @Indexed(sparse = true)
    private String intentId;
    private String donationId;
    private String explorerUrl;
    private Instant createdAt;
    private Instant updatedAt;

    public static String key(String networkId, String txHash) {
        return networkId + ":" + txHash;
    }

    public boolean isClaimedByOther(String claimingIntentId) {
        return intentId != null && !intentId.equals(claimingIntentId);
    }

    public boolean isRecorded() {
        return donationId != null;
    }
}
