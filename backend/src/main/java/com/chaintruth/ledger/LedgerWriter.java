package com.chaintruth.ledger;

import com.chaintruth.common.AmountCodec;
import com.chaintruth.domain.CampaignTotals;
import com.chaintruth.domain.ChainTransactionRecord;
import com.chaintruth.domain.ChainTransactionStatus;
import com.chaintruth.domain.DonationLedgerEntry;
import com.chaintruth.domain.PaymentIntent;
import com.chaintruth.domain.PaymentIntentRepository;
import com.chaintruth.domain.PaymentIntentStatus;
import com.chaintruth.domain.StatusChange;
import com.chaintruth.registry.AssetDefinition;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * The commit unit: claim record, intent CONFIRMED, ledger entry and campaign totals in one MongoDB transaction.
 * Any failure rolls back all four.
 */
@Component
@RequiredArgsConstructor
public class LedgerWriter {

    private final MongoTemplate mongoTemplate;
    private final PaymentIntentRepository intentRepository;

    /**
     * @return the new donation id
     * @throws ClaimConflictException         when the key is committed or owned by another intent
     * @throws IntentNotCommittableException  when the intent refuses the CONFIRMED transition
     */
    @Transactional
    public String write(PaymentIntent intent, AssetDefinition asset, String txHash, VerifiedChainFacts facts,
                        FiatSnapshot snapshot, Instant now) {
        String key = ChainTransactionRecord.key(intent.getNetworkId(), txHash);
        ChainTransactionRecord existing = mongoTemplate.findById(key, ChainTransactionRecord.class);
        if (existing != null && (existing.isRecorded() || existing.isClaimedByOther(intent.getId()))) {
            throw new ClaimConflictException(key);
        }
        String donationId = UUID.randomUUID().toString();

        Query claimQuery = new Query(where("_id").is(key)
                .and("donationId").is(null)
                .orOperator(where("intentId").is(null), where("intentId").is(intent.getId())));
        Update claim = new Update()
                .setOnInsert("createdAt", now)
                .set("networkId", intent.getNetworkId())
                .set("txHash", txHash)
                .set("sender", facts.sender())
                .set("recipient", facts.recipient())
                .set("assetId", asset.id())
                .set("amountRaw", facts.amountRaw())
                .set("decimals", asset.decimals())
                .set("blockHeight", facts.blockHeight())
                .set("status", ChainTransactionStatus.CONFIRMED)
                .set("intentId", intent.getId())
                .set("donationId", donationId)
                .set("explorerUrl", facts.explorerUrl())
                .set("updatedAt", now)
                .max("confirmations", facts.confirmations());
        mongoTemplate.findAndModify(claimQuery, claim,
                FindAndModifyOptions.options().upsert(true).returnNew(true), ChainTransactionRecord.class);

        PaymentIntent confirmed = intentRepository.markConfirmed(intent.getId(), facts.toDetected(txHash),
                        facts.confirmations(), donationId, facts.verificationStartedAt(), now)
                .orElseThrow(() -> new IntentNotCommittableException(intent.getId()));

        DonationLedgerEntry entry = new DonationLedgerEntry();
        entry.setId(donationId);
        entry.setCampaignId(intent.getCampaignId());
        entry.setIntentId(intent.getId());
        entry.setDonorRef(intent.getDonorRef());
        entry.setNetworkId(intent.getNetworkId());
        entry.setAssetId(asset.id());
        entry.setTxHash(txHash);
        entry.setSender(facts.sender());
        entry.setAmountRaw(facts.amountRaw());
        entry.setAmountNative(AmountCodec.fromNative(facts.amountRaw(), asset.decimals()));
        entry.setDecimals(asset.decimals());
        entry.setFiatCurrency(snapshot.currency());
        entry.setFiatRate(snapshot.rate());
        entry.setFiatValue(snapshot.value());
        entry.setExplorerUrl(facts.explorerUrl());
        entry.setConfirmedAfterExpiry(wasExpired(confirmed));
        entry.setCreatedAt(now);
        mongoTemplate.insert(entry);

        Update totals = new Update()
                .inc("raisedRawByAsset." + asset.id(), new BigDecimal(facts.amountRaw()))
                .inc("donationCount", 1)
                .set("updatedAt", now);
        if (snapshot.isPriced()) {
            totals.inc("raisedFiat", snapshot.value());
        } else {
            totals.inc("unpricedCount", 1);
        }
        mongoTemplate.upsert(new Query(where("_id").is(intent.getCampaignId())), totals, CampaignTotals.class);
        return donationId;
    }

    private static boolean wasExpired(PaymentIntent confirmed) {
        List<StatusChange> history = confirmed.getStatusHistory();
        if (history == null || history.isEmpty()) {
            return false;
        }
        return history.stream().anyMatch(change -> change.from() == PaymentIntentStatus.EXPIRED);
    }
}
