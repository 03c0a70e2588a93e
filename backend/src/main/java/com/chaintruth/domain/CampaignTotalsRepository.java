package com.chaintruth.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for campaign_totals. Increments are applied by the ledger writer inside the commit transaction.
 */
public interface CampaignTotalsRepository extends MongoRepository<CampaignTotals, String> {
}
