package com.chaintruth.api.dto;

import com.chaintruth.domain.PaymentIntent;
import com.chaintruth.registry.NetworkDefinition;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Intent view for create and query. {@code amountNative} is the nonced amount the donor must send.
 */
public record IntentResponse(
        String intentId,
        String campaignId,
        String networkId,
        String assetId,
        String status,
        String depositAddress,
        String amountNative,
        String amountRaw,
        String requestedAmountNative,
        BigDecimal amountUsd,
        BigDecimal fxRate,
        String qrString,
        Instant expiresAt,
        long startBlock,
        String explorerBaseUrl,
        String explorerAddressUrl,
        String candidateTxHash,
        Integer confirmations,
        int confirmationsRequired,
        String confirmedTxHash,
        String donationId,
        Instant createdAt
) {

    public static IntentResponse from(PaymentIntent intent, NetworkDefinition network) {
        return new IntentResponse(
                intent.getId(),
                intent.getCampaignId(),
                intent.getNetworkId(),
                intent.getAssetId(),
                intent.getStatus() != null ? intent.getStatus().name() : null,
                intent.getDepositAddress(),
                intent.getExpectedAmountNative(),
                intent.getExpectedAmountRaw() != null ? intent.getExpectedAmountRaw().toString() : null,
                intent.getRequestedAmountNative(),
                intent.getAmountUsd(),
                intent.getFxRate(),
                intent.getPaymentUri(),
                intent.getExpiresAt(),
                intent.getStartBlock(),
                network.explorerBaseUrl(),
                network.explorerAddressUrl(intent.getDepositAddress()),
                intent.getCandidateTxHash(),
                intent.getConfirmations(),
                network.confirmationsRequired(),
                intent.getConfirmedTxHash(),
                intent.getDonationId(),
                intent.getCreatedAt());
    }
}
