package com.chaintruth.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Running totals per campaign. Sums ledger snapshots; never revalued from live prices.
 */
@Document(collection = "campaign_totals")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class CampaignTotals {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    /** Raw native units received, keyed by asset id. */
    private Map<String, BigDecimal> raisedRawByAsset = new HashMap<>();
    private BigDecimal raisedFiat = BigDecimal.ZERO;
    private long donationCount;
    /** Donations committed without a fiat snapshot. */
    private long unpricedCount;
    private Instant updatedAt;
}
