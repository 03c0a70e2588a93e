package com.chaintruth.intent;

import java.math.BigDecimal;

/**
 * Request for a new intent. Exactly one of {@code amountUsd} and {@code amountNative} is set.
 *
 * @param donorRef null for anonymous donations
 */
public record CreateIntentCommand(
        String campaignId,
        String networkId,
        String assetId,
        BigDecimal amountUsd,
        String amountNative,
        String donorRef
) {
}
