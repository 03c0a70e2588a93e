package com.chaintruth.pricing;

import com.chaintruth.config.CaffeineConfig;
import com.chaintruth.pricing.config.PricingProperties;
import com.chaintruth.registry.AssetDefinition;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Spot rate via CoinGecko /simple/price, cached briefly in fiatRateCache.
 * Used for USD-denominated intents and the ledger's valuation snapshot.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CoinGeckoFiatRateProvider implements FiatRateProvider {

    private static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private final PricingProperties pricingProperties;
    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;

    @Override
    @Cacheable(cacheNames = CaffeineConfig.FIAT_RATE_CACHE, key = "#asset.coingeckoId()", condition = "#asset.coingeckoId() != null",
            unless = "#result == null")
    public Optional<BigDecimal> currentRate(AssetDefinition asset) {
        String coinId = asset.coingeckoId();
        if (coinId == null || coinId.isBlank()) {
            log.debug("No CoinGecko id for asset {}", asset.id());
            return Optional.empty();
        }
        String currency = currency();
        String url = pricingProperties.getCoingeckoBaseUrl() + "/simple/price?ids=" + coinId + "&vs_currencies=" + currency;
        try {
            String response = webClientBuilder.build().get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(pricingProperties.getRequestTimeoutSeconds()))
                    .block();
            return parseRate(objectMapper, response, coinId, currency);
        } catch (WebClientResponseException e) {
            log.warn("CoinGecko price failed for {}: {}", coinId, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("CoinGecko price error for {}", coinId, e);
            return Optional.empty();
        }
    }

    @Override
    public String currency() {
        return pricingProperties.getFiatCurrency().toLowerCase(Locale.ROOT);
    }

    static Optional<BigDecimal> parseRate(ObjectMapper mapper, String json, String coinId, String currency) {
        if (json == null) {
            return Optional.empty();
        }
        try {
            JsonNode value = mapper.readTree(json).path(coinId).path(currency);
            if (!value.isNumber() || value.decimalValue().signum() <= 0) {
                return Optional.empty();
            }
            return Optional.of(value.decimalValue().setScale(SCALE, ROUNDING));
        } catch (Exception e) {
            log.warn("Unparseable CoinGecko response for {}", coinId);
            return Optional.empty();
        }
    }
}
