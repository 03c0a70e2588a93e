package com.chaintruth.ledger;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Fiat valuation frozen at confirmation time. Rate and value are null when no price was available.
 */
public record FiatSnapshot(String currency, BigDecimal rate, BigDecimal value) {

    private static final int VALUE_SCALE = 8;

    public static FiatSnapshot of(String currency, BigDecimal rate, BigInteger amountRaw, int decimals) {
        if (rate == null) {
            return unavailable(currency);
        }
        BigDecimal amount = new BigDecimal(amountRaw, decimals);
        return new FiatSnapshot(currency, rate, amount.multiply(rate).setScale(VALUE_SCALE, RoundingMode.HALF_UP));
    }

    public static FiatSnapshot unavailable(String currency) {
        return new FiatSnapshot(currency, null, null);
    }

    public boolean isPriced() {
        return value != null;
    }
}
