package com.chaintruth.ledger;

import com.chaintruth.domain.ChainTransactionRecord;
import com.chaintruth.domain.ChainTransactionRecordRepository;
import com.chaintruth.domain.IntentNotFoundException;
import com.chaintruth.domain.PaymentIntent;
import com.chaintruth.domain.PaymentIntentRepository;
import com.chaintruth.domain.PaymentIntentStatus;
import com.chaintruth.pricing.FiatRateProvider;
import com.chaintruth.registry.AssetDefinition;
import com.chaintruth.registry.AssetNetworkRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;

/**
 * The only writer of donation ledger entries and of the CONFIRMED status. Idempotent on (networkId, txHash):
 * a committed key short-circuits to ALREADY_RECORDED without writing, and a lost race is resolved by re-reading the key.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationCommitter {

    private final ChainTransactionRecordRepository chainTransactionRepository;
    private final PaymentIntentRepository intentRepository;
    private final LedgerWriter ledgerWriter;
    private final FiatRateProvider fiatRateProvider;
    private final AssetNetworkRegistry registry;
    private final Clock clock;

    public CommitResult commit(String intentId, String networkId, String txHash, VerifiedChainFacts facts) {
        String key = ChainTransactionRecord.key(networkId, txHash);
        Optional<CommitResult> settled = settledByExistingClaim(key, intentId);
        if (settled.isPresent()) {
            return settled.get();
        }
        PaymentIntent intent = intentRepository.findById(intentId).orElseThrow(() -> new IntentNotFoundException(intentId));
        if (!networkId.equals(intent.getNetworkId())) {
            throw new IllegalArgumentException("Intent " + intentId + " expects network " + intent.getNetworkId() + ", not " + networkId);
        }
        AssetDefinition asset = registry.asset(intent.getAssetId());
        FiatSnapshot snapshot = snapshot(asset, facts);
        try {
            String donationId = ledgerWriter.write(intent, asset, txHash, facts, snapshot, clock.instant());
            log.info("Recorded donation {} for intent {} ({} {} on {}, tx {})", donationId, intentId,
                    facts.amountRaw(), asset.id(), networkId, txHash);
            return CommitResult.recorded(donationId);
        } catch (ClaimConflictException | DataAccessException | TransactionException e) {
            return resolveLostRace(key, intentId, e);
        } catch (IntentNotCommittableException e) {
            PaymentIntentStatus status = intentRepository.findById(intentId).map(PaymentIntent::getStatus).orElse(null);
            log.warn("Intent {} not committable in status {} for tx {}", intentId, status, txHash);
            return CommitResult.notCommittable(status);
        }
    }

    private Optional<CommitResult> settledByExistingClaim(String key, String intentId) {
        Optional<ChainTransactionRecord> existing = chainTransactionRepository.findById(key);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        ChainTransactionRecord record = existing.get();
        if (record.isClaimedByOther(intentId)) {
            log.warn("{} is claimed by intent {}, not {}", key, record.getIntentId(), intentId);
            return Optional.of(CommitResult.claimedByOther());
        }
        if (record.isRecorded()) {
            log.info("{} already recorded as donation {}", key, record.getDonationId());
            return Optional.of(CommitResult.alreadyRecorded(record.getDonationId()));
        }
        return Optional.empty();
    }

    private CommitResult resolveLostRace(String key, String intentId, RuntimeException cause) {
        Optional<CommitResult> settled = settledByExistingClaim(key, intentId);
        if (settled.isPresent()) {
            log.info("Commit of {} for intent {} lost a race: {}", key, intentId, settled.get().kind());
            return settled.get();
        }
        log.warn("Commit of {} for intent {} failed and was rolled back", key, intentId, cause);
        throw cause;
    }

    private FiatSnapshot snapshot(AssetDefinition asset, VerifiedChainFacts facts) {
        String currency = fiatRateProvider.currency();
        Optional<BigDecimal> rate = fiatRateProvider.currentRate(asset);
        if (rate.isEmpty()) {
            log.warn("No {} rate for {}; committing without valuation", currency, asset.id());
            return FiatSnapshot.unavailable(currency);
        }
        return FiatSnapshot.of(currency, rate.get(), facts.amountRaw(), asset.decimals());
    }
}
