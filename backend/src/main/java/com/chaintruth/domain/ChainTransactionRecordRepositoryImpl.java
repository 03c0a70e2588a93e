package com.chaintruth.domain;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Implementation of ChainTransactionRecordRepositoryCustom using MongoTemplate upserts on the key.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class ChainTransactionRecordRepositoryImpl implements ChainTransactionRecordRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public void recordSeen(String networkId, String txHash, String sender, Long blockHeight, int confirmations, Instant now) {
        String key = ChainTransactionRecord.key(networkId, txHash);
        Update update = new Update()
                .setOnInsert("networkId", networkId)
                .setOnInsert("txHash", txHash)
                .setOnInsert("sender", sender)
                .setOnInsert("status", ChainTransactionStatus.SEEN)
                .setOnInsert("createdAt", now)
                .max("confirmations", confirmations)
                .set("updatedAt", now);
        if (blockHeight != null) {
            update.set("blockHeight", blockHeight);
        }
        try {
            mongoTemplate.upsert(new Query(where("_id").is(key)), update, ChainTransactionRecord.class);
        } catch (DuplicateKeyException e) {
            // concurrent first observation; the other writer inserted the same facts
            log.debug("Concurrent insert of {}", key);
        }
    }

    @Override
    public Optional<ChainTransactionRecord> claimForConfirming(ChainTransactionRecord claim, Instant now) {
        Query query = new Query(where("_id").is(claim.getId())
                .and("donationId").is(null)
                .orOperator(where("intentId").is(null), where("intentId").is(claim.getIntentId())));
        Update update = new Update()
                .setOnInsert("createdAt", now)
                .set("networkId", claim.getNetworkId())
                .set("txHash", claim.getTxHash())
                .set("sender", claim.getSender())
                .set("recipient", claim.getRecipient())
                .set("assetId", claim.getAssetId())
                .set("amountRaw", claim.getAmountRaw())
                .set("decimals", claim.getDecimals())
                .set("blockHeight", claim.getBlockHeight())
                .set("status", ChainTransactionStatus.CONFIRMING)
                .set("intentId", claim.getIntentId())
                .set("explorerUrl", claim.getExplorerUrl())
                .set("updatedAt", now)
                .max("confirmations", claim.getConfirmations() != null ? claim.getConfirmations() : 0);
        try {
            return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                    FindAndModifyOptions.options().upsert(true).returnNew(true), ChainTransactionRecord.class));
        } catch (DuplicateKeyException e) {
            // record exists but belongs to another intent or is already recorded
            return Optional.empty();
        }
    }

    @Override
    public void releaseClaim(String key, String intentId, Instant now) {
        Query query = new Query(where("_id").is(key).and("intentId").is(intentId).and("donationId").is(null));
        Update update = new Update()
                .set("intentId", null)
                .set("status", ChainTransactionStatus.SEEN)
                .set("updatedAt", now);
        mongoTemplate.updateFirst(query, update, ChainTransactionRecord.class);
        log.info("Released claim on {} by intent {}", key, intentId);
    }
}
