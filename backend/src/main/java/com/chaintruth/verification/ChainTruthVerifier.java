package com.chaintruth.verification;

import com.chaintruth.chain.ChainClient;
import com.chaintruth.chain.ChainClientDispatcher;
import com.chaintruth.chain.RpcException;
import com.chaintruth.chain.TxHashNormalizer;
import com.chaintruth.chain.facts.ChainFactsNormalizer;
import com.chaintruth.chain.facts.ChainTxFacts;
import com.chaintruth.chain.facts.NormalizedChainTx;
import com.chaintruth.chain.facts.ObservedTransfer;
import com.chaintruth.common.AmountCodec;
import com.chaintruth.common.RetryPolicy;
import com.chaintruth.domain.AssetType;
import com.chaintruth.domain.ChainTransactionRecord;
import com.chaintruth.domain.ChainTransactionRecordRepository;
import com.chaintruth.domain.DetectedTransfer;
import com.chaintruth.domain.IntentNotFoundException;
import com.chaintruth.domain.PaymentIntent;
import com.chaintruth.domain.PaymentIntentRepository;
import com.chaintruth.domain.PaymentIntentStatus;
import com.chaintruth.ledger.CommitResult;
import com.chaintruth.ledger.ReconciliationCommitter;
import com.chaintruth.ledger.VerifiedChainFacts;
import com.chaintruth.registry.AssetDefinition;
import com.chaintruth.registry.AssetNetworkRegistry;
import com.chaintruth.registry.NetworkDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Decides whether one transaction satisfies one intent. Checks run in a fixed order:
 * hash format, fetch, recipient, replay guard, asset, amount, liveness, confirmations.
 * The replay guard runs before asset and amount so an old transaction is always rejected the same way.
 * <p>
 * Every checkpoint yields a {@link VerificationOutcome}; only input errors on the intent id itself throw.
 * Transient failures leave the intent exactly as it was.
 */
@Service
@Slf4j
public class ChainTruthVerifier {

    private final AssetNetworkRegistry registry;
    private final PaymentIntentRepository intentRepository;
    private final ChainTransactionRecordRepository chainTransactionRepository;
    private final ChainClientDispatcher clientDispatcher;
    private final ChainFactsNormalizer factsNormalizer;
    private final ReconciliationCommitter committer;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    public ChainTruthVerifier(AssetNetworkRegistry registry,
                              PaymentIntentRepository intentRepository,
                              ChainTransactionRecordRepository chainTransactionRepository,
                              ChainClientDispatcher clientDispatcher,
                              ChainFactsNormalizer factsNormalizer,
                              ReconciliationCommitter committer,
                              @Qualifier("chainRetryPolicy") RetryPolicy retryPolicy,
                              Clock clock) {
        this.registry = registry;
        this.intentRepository = intentRepository;
        this.chainTransactionRepository = chainTransactionRepository;
        this.clientDispatcher = clientDispatcher;
        this.factsNormalizer = factsNormalizer;
        this.committer = committer;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
    }

    /**
     * @throws IntentNotFoundException when no intent has this id
     */
    public VerificationOutcome verify(String intentId, String rawTxHash, VerificationMode mode) {
        Instant startedAt = clock.instant();
        PaymentIntent intent = intentRepository.findById(intentId).orElseThrow(() -> new IntentNotFoundException(intentId));
        Optional<VerificationOutcome> closed = closedOutcome(intent, null);
        if (closed.isPresent()) {
            return closed.get();
        }
        NetworkDefinition network = registry.network(intent.getNetworkId());
        AssetDefinition asset = registry.asset(intent.getAssetId());

        Optional<String> normalized = TxHashNormalizer.normalize(network.family(), rawTxHash);
        if (normalized.isEmpty()) {
            return reject(intent, null, mode, RejectionReason.INVALID_HASH_FORMAT,
                    "Not a " + network.family() + " transaction hash: " + rawTxHash, false);
        }
        String txHash = normalized.get();
        if (intent.getStatus() == PaymentIntentStatus.CONFIRMING && !txHash.equals(intent.getCandidateTxHash())) {
            return reject(intent, txHash, mode, RejectionReason.CANDIDATE_CONFLICT,
                    "Intent is confirming " + intent.getCandidateTxHash(), false);
        }
        Optional<ChainTransactionRecord> existing = chainTransactionRepository.findById(ChainTransactionRecord.key(network.id(), txHash));
        if (existing.isPresent() && existing.get().isClaimedByOther(intentId)) {
            return reject(intent, txHash, mode, RejectionReason.ALREADY_CLAIMED,
                    "Transaction belongs to another intent", false);
        }
        if (existing.isPresent() && existing.get().isRecorded()) {
            return VerificationOutcome.alreadyRecorded(intentId, txHash, existing.get().getDonationId());
        }

        ChainClient client = clientDispatcher.forNetwork(network);
        ChainTxFacts facts;
        long head;
        try {
            Optional<ChainTxFacts> fetched = withRetry(() -> client.fetchTransaction(network, txHash), "fetch " + txHash, network);
            if (fetched.isEmpty()) {
                return reject(intent, txHash, mode, RejectionReason.TRANSACTION_NOT_FOUND,
                        "Transaction not found on " + network.id() + " yet", false);
            }
            facts = fetched.get();
            head = withRetry(() -> client.currentHeight(network), "head", network);
        } catch (RpcException e) {
            log.warn("Chain unavailable verifying {} for intent {}: {}", txHash, intentId, e.getMessage());
            return reject(intent, txHash, mode, RejectionReason.RPC_UNAVAILABLE, e.getMessage(), false);
        }

        NormalizedChainTx tx = factsNormalizer.normalize(facts);
        int confirmations = confirmations(tx, head);
        Instant now = clock.instant();
        chainTransactionRepository.recordSeen(network.id(), txHash, tx.sender(), tx.blockHeight(), confirmations, now);

        if (mode == VerificationMode.MANUAL && intent.getStatus() != PaymentIntentStatus.CONFIRMING) {
            Optional<PaymentIntent> detecting = intentRepository.markDetecting(intentId, txHash, startedAt, now);
            if (detecting.isEmpty()) {
                return rereadOutcome(intentId, txHash);
            }
            intent = detecting.get();
        }

        Evaluation evaluation = evaluate(intent, network, asset, tx);
        if (evaluation.reason() != null) {
            return handleFailedCheck(intent, network, txHash, mode, tx, evaluation);
        }

        if (intent.getStatus() == PaymentIntentStatus.CREATED) {
            Optional<PaymentIntent> detecting = intentRepository.markDetecting(intentId, txHash, startedAt, now);
            if (detecting.isEmpty()) {
                return rereadOutcome(intentId, txHash);
            }
            intent = detecting.get();
        }

        VerifiedChainFacts verified = new VerifiedChainFacts(tx.sender(), intent.getDepositAddress(), evaluation.received(),
                tx.blockHeight(), confirmations, network.explorerTxUrl(txHash), startedAt);
        int required = network.confirmationsRequired();
        if (!tx.isPending() && confirmations >= required) {
            return commit(intent, network, txHash, verified, required);
        }
        return trackConfirming(intent, network, asset, txHash, verified, required);
    }

    private VerificationOutcome commit(PaymentIntent intent, NetworkDefinition network, String txHash,
                                       VerifiedChainFacts verified, int required) {
        CommitResult result = committer.commit(intent.getId(), network.id(), txHash, verified);
        switch (result.kind()) {
            case RECORDED:
                return VerificationOutcome.confirmed(intent.getId(), txHash, result.donationId(), verified.confirmations(), required);
            case ALREADY_RECORDED:
                return VerificationOutcome.alreadyRecorded(intent.getId(), txHash, result.donationId());
            case CLAIMED_BY_OTHER:
                return VerificationOutcome.rejected(intent.getId(), txHash, intent.getStatus(), RejectionReason.ALREADY_CLAIMED,
                        "Transaction belongs to another intent");
            default:
                return rereadOutcome(intent.getId(), txHash);
        }
    }

    private VerificationOutcome trackConfirming(PaymentIntent intent, NetworkDefinition network, AssetDefinition asset,
                                                String txHash, VerifiedChainFacts verified, int required) {
        Instant now = clock.instant();
        ChainTransactionRecord claim = new ChainTransactionRecord();
        claim.setId(ChainTransactionRecord.key(network.id(), txHash));
        claim.setNetworkId(network.id());
        claim.setTxHash(txHash);
        claim.setSender(verified.sender());
        claim.setRecipient(verified.recipient());
        claim.setAssetId(asset.id());
        claim.setAmountRaw(verified.amountRaw());
        claim.setDecimals(asset.decimals());
        claim.setBlockHeight(verified.blockHeight());
        claim.setConfirmations(verified.confirmations());
        claim.setIntentId(intent.getId());
        claim.setExplorerUrl(verified.explorerUrl());
        if (chainTransactionRepository.claimForConfirming(claim, now).isEmpty()) {
            return VerificationOutcome.rejected(intent.getId(), txHash, intent.getStatus(), RejectionReason.ALREADY_CLAIMED,
                    "Transaction belongs to another intent");
        }
        Optional<PaymentIntent> confirming = intentRepository.markConfirming(intent.getId(), verified.toDetected(txHash),
                verified.confirmations(), verified.verificationStartedAt(), now);
        if (confirming.isEmpty()) {
            chainTransactionRepository.releaseClaim(claim.getId(), intent.getId(), now);
            return rereadOutcome(intent.getId(), txHash);
        }
        log.info("Intent {} tracking {} on {}: {}/{} confirmations", intent.getId(), txHash, network.id(),
                verified.confirmations(), required);
        return VerificationOutcome.pending(intent.getId(), txHash, verified.confirmations(), required);
    }

    private VerificationOutcome handleFailedCheck(PaymentIntent intent, NetworkDefinition network, String txHash,
                                                  VerificationMode mode, NormalizedChainTx tx, Evaluation evaluation) {
        RejectionReason reason = evaluation.reason();
        DetectedTransfer detected = new DetectedTransfer(txHash, tx.sender(), intent.getDepositAddress(),
                evaluation.received(), tx.blockHeight(), tx.succeeded());
        boolean tracked = intent.getStatus() == PaymentIntentStatus.CONFIRMING && txHash.equals(intent.getCandidateTxHash());
        if (reason.category() == RejectionReason.Category.FINANCIAL && (mode == VerificationMode.MANUAL || tracked)) {
            PaymentIntentStatus target = reason == RejectionReason.ON_CHAIN_FAILURE
                    ? PaymentIntentStatus.FAILED
                    : PaymentIntentStatus.MISMATCH;
            Optional<PaymentIntent> flagged = intentRepository.markFlagged(intent.getId(), target, detected,
                    reason.name(), clock.instant());
            if (flagged.isPresent()) {
                log.warn("Intent {} flagged {}: {} ({})", intent.getId(), target, reason, evaluation.detail());
                return VerificationOutcome.rejected(intent.getId(), txHash, target, reason, evaluation.detail());
            }
            return rereadOutcome(intent.getId(), txHash);
        }
        return reject(intent, txHash, mode, reason, evaluation.detail(), true);
    }

    Evaluation evaluate(PaymentIntent intent, NetworkDefinition network, AssetDefinition asset, NormalizedChainTx tx) {
        List<ObservedTransfer> toDeposit = tx.transfersTo(intent.getDepositAddress(), network.family()::sameAddress);
        if (toDeposit.isEmpty()) {
            return Evaluation.failed(RejectionReason.WRONG_RECIPIENT, null,
                    "Transaction pays nothing to " + intent.getDepositAddress());
        }
        if (!tx.isPending() && tx.blockHeight() < intent.getStartBlock()) {
            return Evaluation.failed(RejectionReason.REPLAY_REJECTED, null,
                    "Mined at " + tx.blockHeight() + ", before replay guard " + intent.getStartBlock());
        }
        if (asset.type() == AssetType.NATIVE && !asset.symbol().equalsIgnoreCase(network.nativeSymbol())) {
            return Evaluation.failed(RejectionReason.ASSET_MISMATCH, null,
                    asset.symbol() + " is not the native coin of " + network.id());
        }
        List<ObservedTransfer> inAsset = toDeposit.stream()
                .filter(t -> asset.matchesRef(t.assetRef(), network.family()))
                .collect(Collectors.toList());
        if (inAsset.isEmpty()) {
            return Evaluation.failed(RejectionReason.ASSET_MISMATCH, null,
                    "No " + asset.symbol() + " transfer to the deposit address");
        }
        BigInteger received = NormalizedChainTx.sum(inAsset);
        BigInteger expected = intent.getExpectedAmountRaw();
        if (!AmountCodec.matches(received, expected)) {
            String detail = "Received " + received + ", expected " + expected;
            if (AmountCodec.withinNonceBand(received, expected, intent.getNonceWidth())) {
                return Evaluation.failed(RejectionReason.NONCE_MISMATCH, received, detail);
            }
            return Evaluation.failed(RejectionReason.AMOUNT_MISMATCH, received, detail);
        }
        if (!tx.succeeded()) {
            return Evaluation.failed(RejectionReason.ON_CHAIN_FAILURE, received, "Transaction failed on-chain");
        }
        return Evaluation.passed(received);
    }

    static int confirmations(NormalizedChainTx tx, long head) {
        if (tx.isPending()) {
            return 0;
        }
        long diff = head - tx.blockHeight();
        return (int) Math.max(0L, Math.min(Integer.MAX_VALUE, diff));
    }

    private VerificationOutcome reject(PaymentIntent intent, String txHash, VerificationMode mode, RejectionReason reason,
                                       String detail, boolean audit) {
        log.warn("Rejected {} for intent {}: {} ({})", txHash, intent.getId(), reason, detail);
        if (audit && mode == VerificationMode.MANUAL) {
            intentRepository.recordRejection(intent.getId(), reason.name(), clock.instant());
        }
        return VerificationOutcome.rejected(intent.getId(), txHash, intent.getStatus(), reason, detail);
    }

    private VerificationOutcome rereadOutcome(String intentId, String txHash) {
        PaymentIntent current = intentRepository.findById(intentId).orElseThrow(() -> new IntentNotFoundException(intentId));
        return closedOutcome(current, txHash).orElseGet(() -> VerificationOutcome.rejected(intentId, txHash, current.getStatus(),
                RejectionReason.CANDIDATE_CONFLICT, "Intent changed concurrently; now tracking " + current.getCandidateTxHash()));
    }

    private static Optional<VerificationOutcome> closedOutcome(PaymentIntent intent, String txHash) {
        if (intent.getStatus() == PaymentIntentStatus.CONFIRMED) {
            return Optional.of(VerificationOutcome.alreadyRecorded(intent.getId(), intent.getConfirmedTxHash(), intent.getDonationId()));
        }
        if (intent.getStatus().isTerminal()) {
            return Optional.of(VerificationOutcome.rejected(intent.getId(), txHash, intent.getStatus(),
                    RejectionReason.ALREADY_TERMINAL, "Intent is " + intent.getStatus()));
        }
        return Optional.empty();
    }

    private <T> T withRetry(Supplier<T> call, String what, NetworkDefinition network) {
        RpcException last = null;
        for (int attempt = 0; attempt < retryPolicy.getMaxAttempts(); attempt++) {
            if (attempt > 0 && !retryPolicy.pause(attempt - 1)) {
                throw new RpcException("Interrupted while retrying " + what, last);
            }
            try {
                return call.get();
            } catch (RpcException e) {
                last = e;
                log.debug("{} on {} failed (attempt {}/{}): {}", what, network.id(), attempt + 1,
                        retryPolicy.getMaxAttempts(), e.getMessage());
            }
        }
        throw last;
    }

    record Evaluation(RejectionReason reason, BigInteger received, String detail) {

        static Evaluation passed(BigInteger received) {
            return new Evaluation(null, received, null);
        }

        static Evaluation failed(RejectionReason reason, BigInteger received, String detail) {
            return new Evaluation(reason, received, detail);
        }
    }
}
