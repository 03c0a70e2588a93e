package com.chaintruth.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

/**
 * POST /api/v1/intents request body. Exactly one of amountUsd and amountNative.
 */
public record CreateIntentRequest(
        @NotBlank(message = "INVALID_CAMPAIGN")
        String campaignId,

        @NotBlank(message = "INVALID_NETWORK")
        String networkId,

        @NotBlank(message = "INVALID_ASSET")
        String assetId,

        @Positive(message = "MALFORMED_AMOUNT")
        BigDecimal amountUsd,

        String amountNative,

        String donorRef
) {
}
