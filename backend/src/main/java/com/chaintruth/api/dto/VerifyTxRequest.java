package com.chaintruth.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/intents/{id}/verify request body. Any casing or prefix; normalized per network family.
 */
public record VerifyTxRequest(
        @NotBlank(message = "INVALID_HASH_FORMAT")
        String txHash
) {
}
