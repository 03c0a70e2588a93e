package com.chaintruth.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

/**
 * Persistence for payment_intents. Status changes go through {@link PaymentIntentRepositoryCustom} only.
 */
public interface PaymentIntentRepository extends MongoRepository<PaymentIntent, String>, PaymentIntentRepositoryCustom {

    List<PaymentIntent> findByNetworkIdAndDepositAddressAndStatusIn(
            String networkId, String depositAddress, Collection<PaymentIntentStatus> statuses);

    List<PaymentIntent> findByStatus(PaymentIntentStatus status);

    long countByCampaignIdAndStatus(String campaignId, PaymentIntentStatus status);
}
