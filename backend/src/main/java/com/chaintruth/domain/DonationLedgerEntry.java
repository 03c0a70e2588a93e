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

/**
 * Committed donation. Append-only: written once by the reconciliation committer, never updated.
 * The fiat fields are a snapshot taken at confirmation time.
 */
@Document(collection = "donation_ledger")
@CompoundIndexes({
    @CompoundIndex(name = "network_tx_uniq", def = "{'networkId': 1, 'txHash': 1}", unique = true),
    @CompoundIndex(name = "intent_uniq", def = "{'intentId': 1}", unique = true),
    @CompoundIndex(name = "campaign_created", def = "{'campaignId': 1, 'createdAt': -1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class DonationLedgerEntry {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String campaignId;
    private String intentId;
    /** Null for anonymous donors. */
    private String donorRef;
    private String networkId;
    private String assetId;
    private String txHash;
    private String sender;
    private BigInteger amountRaw;
    private String amountNative;
    private int decimals;
    private String fiatCurrency;
    /** Null when no rate was available at confirmation. */
    private BigDecimal fiatRate;
    private BigDecimal fiatValue;
    private String explorerUrl;
    private boolean confirmedAfterExpiry;
    private Instant createdAt;
}
