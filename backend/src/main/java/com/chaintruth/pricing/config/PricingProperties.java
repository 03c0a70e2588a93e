package com.chaintruth.pricing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Fiat pricing configuration. Documented in application.yml under chaintruth.pricing.
 */
@ConfigurationProperties(prefix = "chaintruth.pricing")
@Getter
@Setter
public class PricingProperties {

    /**
     * CoinGecko API base URL (free: https://api.coingecko.com/api/v3).
     */
    private String coingeckoBaseUrl = "https://api.coingecko.com/api/v3";

    /**
     * Quote currency, lowercase as CoinGecko expects (usd).
     */
    private String fiatCurrency = "usd";

    /**
     * Timeout in seconds for one price request.
     */
    private int requestTimeoutSeconds = 10;
}
