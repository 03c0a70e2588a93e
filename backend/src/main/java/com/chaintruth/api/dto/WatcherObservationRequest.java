package com.chaintruth.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * POST /api/v1/watchers/observations request body.
 */
public record WatcherObservationRequest(
        @NotBlank(message = "INVALID_NETWORK")
        String networkId,

        @NotBlank(message = "INVALID_ADDRESS")
        String address,

        @NotBlank(message = "INVALID_HASH_FORMAT")
        String txHash,

        @PositiveOrZero(message = "INVALID_BLOCK_HEIGHT")
        Long blockHeight
) {
}
