package com.chaintruth.ledger;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Campaign totals with per-asset amounts in display decimals.
 */
public record CampaignTotalsView(
        String campaignId,
        Map<String, String> raisedByAsset,
        BigDecimal raisedFiat,
        String fiatCurrency,
        long donationCount,
        long unpricedCount,
        Instant updatedAt
) {
}
