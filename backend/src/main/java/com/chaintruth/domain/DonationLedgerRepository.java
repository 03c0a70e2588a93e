package com.chaintruth.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for donation_ledger. Inserts only.
 */
public interface DonationLedgerRepository extends MongoRepository<DonationLedgerEntry, String> {

    Optional<DonationLedgerEntry> findByNetworkIdAndTxHash(String networkId, String txHash);

    Optional<DonationLedgerEntry> findByIntentId(String intentId);

    List<DonationLedgerEntry> findByCampaignIdOrderByCreatedAtDesc(String campaignId);

    long countByNetworkIdAndTxHash(String networkId, String txHash);
}
