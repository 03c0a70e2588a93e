package com.chaintruth.ledger;

import com.chaintruth.domain.CampaignTotals;
import com.chaintruth.domain.CampaignTotalsRepository;
import com.chaintruth.pricing.FiatRateProvider;
import com.chaintruth.registry.TestCatalog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CampaignTotalsServiceTest {

    @Mock
    private CampaignTotalsRepository totalsRepository;
    @Mock
    private FiatRateProvider fiatRateProvider;

    @Test
    void totals_formatsRawAmountsWithAssetDecimals() {
        CampaignTotals totals = new CampaignTotals();
        totals.setId("campaign-1");
        totals.getRaisedRawByAsset().put("eth_ethereum_mainnet", new BigDecimal("150000000000123456"));
        totals.getRaisedRawByAsset().put("btc_bitcoin_mainnet", new BigDecimal("2500000"));
        totals.setRaisedFiat(new BigDecimal("1950.50"));
        totals.setDonationCount(3);
        totals.setUnpricedCount(1);
        totals.setUpdatedAt(Instant.parse("2025-06-01T12:00:00Z"));
        when(totalsRepository.findById("campaign-1")).thenReturn(Optional.of(totals));
        when(fiatRateProvider.currency()).thenReturn("usd");
        CampaignTotalsService service = new CampaignTotalsService(totalsRepository, TestCatalog.registry(), fiatRateProvider);

        CampaignTotalsView view = service.totals("campaign-1").orElseThrow();

        assertThat(view.raisedByAsset())
                .containsEntry("eth_ethereum_mainnet", "0.150000000000123456")
                .containsEntry("btc_bitcoin_mainnet", "0.025");
        assertThat(view.raisedFiat()).isEqualByComparingTo("1950.50");
        assertThat(view.donationCount()).isEqualTo(3);
        assertThat(view.unpricedCount()).isEqualTo(1);
        assertThat(view.fiatCurrency()).isEqualTo("usd");
    }

    @Test
    void totals_unknownCampaign_isEmpty() {
        when(totalsRepository.findById("nope")).thenReturn(Optional.empty());
        CampaignTotalsService service = new CampaignTotalsService(totalsRepository, TestCatalog.registry(), fiatRateProvider);

        assertThat(service.totals("nope")).isEmpty();
    }
}
