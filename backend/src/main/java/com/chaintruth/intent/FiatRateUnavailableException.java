package com.chaintruth.intent;

/**
 * A fiat-denominated intent cannot be priced right now.
 */
public class FiatRateUnavailableException extends RuntimeException {

    public FiatRateUnavailableException(String assetId) {
        super("No fiat rate available for " + assetId);
    }
}
