package com.chaintruth.api.dto;

import com.chaintruth.ledger.CampaignTotalsView;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * GET /api/v1/campaigns/{id}/totals. Amounts per asset are display decimals; raisedFiat sums ledger snapshots.
 */
public record CampaignTotalsResponse(
        String campaignId,
        Map<String, String> raisedByAsset,
        BigDecimal raisedFiat,
        String fiatCurrency,
        long donationCount,
        long unpricedCount,
        Instant updatedAt
) {

    public static CampaignTotalsResponse from(CampaignTotalsView view) {
        return new CampaignTotalsResponse(
                view.campaignId(),
                view.raisedByAsset(),
                view.raisedFiat(),
                view.fiatCurrency(),
                view.donationCount(),
                view.unpricedCount(),
                view.updatedAt());
    }
}
