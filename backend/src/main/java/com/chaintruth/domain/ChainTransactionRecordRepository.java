package com.chaintruth.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Persistence for chain_transactions, keyed by {@code networkId:txHash}.
 */
public interface ChainTransactionRecordRepository extends MongoRepository<ChainTransactionRecord, String>,
        ChainTransactionRecordRepositoryCustom {

    Optional<ChainTransactionRecord> findByIntentId(String intentId);
}
