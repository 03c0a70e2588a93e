package com.chaintruth.ledger;

import com.chaintruth.common.AmountCodec;
import com.chaintruth.domain.CampaignTotals;
import com.chaintruth.domain.CampaignTotalsRepository;
import com.chaintruth.pricing.FiatRateProvider;
import com.chaintruth.registry.AssetDefinition;
import com.chaintruth.registry.AssetNetworkRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Read side of campaign totals.
 */
@Service
@RequiredArgsConstructor
public class CampaignTotalsService {

    private final CampaignTotalsRepository totalsRepository;
    private final AssetNetworkRegistry registry;
    private final FiatRateProvider fiatRateProvider;

    public Optional<CampaignTotalsView> totals(String campaignId) {
        return totalsRepository.findById(campaignId).map(this::toView);
    }

    private CampaignTotalsView toView(CampaignTotals totals) {
        Map<String, String> byAsset = new TreeMap<>();
        totals.getRaisedRawByAsset().forEach((assetId, raw) -> {
            int decimals = registry.assets().stream()
                    .filter(a -> a.id().equals(assetId))
                    .findFirst()
                    .map(AssetDefinition::decimals)
                    .orElse(0);
            byAsset.put(assetId, AmountCodec.fromNative(raw.toBigIntegerExact(), decimals));
        });
        return new CampaignTotalsView(
                totals.getId(),
                byAsset,
                totals.getRaisedFiat() != null ? totals.getRaisedFiat() : BigDecimal.ZERO,
                fiatRateProvider.currency(),
                totals.getDonationCount(),
                totals.getUnpricedCount(),
                totals.getUpdatedAt());
    }
}
