package com.chaintruth.pricing;

import com.chaintruth.registry.AssetDefinition;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Current fiat price of one whole unit of an asset. Empty when no price is available.
 */
public interface FiatRateProvider {

    Optional<BigDecimal> currentRate(AssetDefinition asset);

    /** ISO currency code the rates are quoted in. */
    String currency();
}
