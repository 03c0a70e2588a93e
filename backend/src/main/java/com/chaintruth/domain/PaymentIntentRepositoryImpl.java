package com.chaintruth.domain;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Implementation of PaymentIntentRepositoryCustom using MongoTemplate.findAndModify with a
 * status + revision guard.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class PaymentIntentRepositoryImpl implements PaymentIntentRepositoryCustom {

    /** Re-reads after losing a race before giving up. */
    static final int MAX_CAS_ATTEMPTS = 5;

    private static final EnumSet<PaymentIntentStatus> EXPIRABLE =
            EnumSet.of(PaymentIntentStatus.CREATED, PaymentIntentStatus.DETECTING);

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<PaymentIntent> markDetecting(String intentId, String txHash, Instant verificationStartedAt, Instant now) {
        return transition(intentId, PaymentIntentStatus.DETECTING, now, "candidate", txHash,
                current -> current.getStatus() != PaymentIntentStatus.EXPIRED
                        || expiredDuring(current, verificationStartedAt),
                update -> update.set("candidateTxHash", txHash));
    }

    @Override
    public Optional<PaymentIntent> markConfirming(String intentId, DetectedTransfer detected, int confirmations,
                                                  Instant verificationStartedAt, Instant now) {
        return transition(intentId, PaymentIntentStatus.CONFIRMING, now, "confirmations=" + confirmations, detected.getTxHash(),
                current -> {
                    if (current.getStatus() == PaymentIntentStatus.EXPIRED) {
                        return expiredDuring(current, verificationStartedAt);
                    }
                    return current.getStatus() != PaymentIntentStatus.CONFIRMING
                            || detected.getTxHash().equals(current.getCandidateTxHash());
                },
                update -> update.set("candidateTxHash", detected.getTxHash())
                        .set("detected", detected)
                        .max("confirmations", confirmations));
    }

    @Override
    public Optional<PaymentIntent> markFlagged(String intentId, PaymentIntentStatus target, DetectedTransfer detected,
                                               String reason, Instant now) {
        if (target != PaymentIntentStatus.MISMATCH && target != PaymentIntentStatus.FAILED) {
            throw new IllegalArgumentException("Not a flagged status: " + target);
        }
        return transition(intentId, target, now, reason, detected.getTxHash(),
                current -> current.getStatus() != PaymentIntentStatus.CONFIRMING
                        || detected.getTxHash().equals(current.getCandidateTxHash()),
                update -> update.set("candidateTxHash", detected.getTxHash())
                        .set("detected", detected)
                        .set("lastRejectionReason", reason));
    }

    @Override
    public Optional<PaymentIntent> markConfirmed(String intentId, DetectedTransfer detected, int confirmations,
                                                 String donationId, Instant verificationStartedAt, Instant now) {
        return transition(intentId, PaymentIntentStatus.CONFIRMED, now, "donation=" + donationId, detected.getTxHash(),
                current -> {
                    if (current.getStatus() == PaymentIntentStatus.EXPIRED) {
                        return expiredDuring(current, verificationStartedAt);
                    }
                    return current.getStatus() != PaymentIntentStatus.CONFIRMING
                            || detected.getTxHash().equals(current.getCandidateTxHash());
                },
                update -> update.set("candidateTxHash", detected.getTxHash())
                        .set("detected", detected)
                        .set("confirmedTxHash", detected.getTxHash())
                        .set("donationId", donationId)
                        .set("confirmedAt", now)
                        .max("confirmations", confirmations));
    }

    @Override
    public Optional<PaymentIntent> markExpired(String intentId, Instant now) {
        return transition(intentId, PaymentIntentStatus.EXPIRED, now, "expired", null,
                current -> current.getExpiresAt() != null && current.getExpiresAt().isBefore(now),
                update -> update.set("expiredAt", now));
    }

    @Override
    public void recordRejection(String intentId, String reason, Instant now) {
        Query query = new Query(where("_id").is(intentId).and("status").nin(terminalStatuses()));
        mongoTemplate.updateFirst(query, new Update().set("lastRejectionReason", reason).set("updatedAt", now), PaymentIntent.class);
    }

    @Override
    public void advanceScanCursor(String intentId, String networkId, long blockHeight) {
        Query query = new Query(where("_id").is(intentId));
        mongoTemplate.updateFirst(query, new Update().max("lastScannedBlockByNetwork." + networkId, blockHeight), PaymentIntent.class);
    }

    @Override
    public List<PaymentIntent> findExpirable(Instant now, int limit) {
        Query query = new Query(where("status").in(EXPIRABLE).and("expiresAt").lt(now))
                .with(Sort.by(Sort.Direction.ASC, "expiresAt"))
                .limit(limit);
        return mongoTemplate.find(query, PaymentIntent.class);
    }

    private Optional<PaymentIntent> transition(String intentId, PaymentIntentStatus target, Instant now, String reason,
                                               String txHash, Predicate<PaymentIntent> guard, Consumer<Update> changes) {
        for (int attempt = 0; attempt < MAX_CAS_ATTEMPTS; attempt++) {
            PaymentIntent current = mongoTemplate.findById(intentId, PaymentIntent.class);
            if (current == null) {
                return Optional.empty();
            }
            if (!IntentTransitions.isAllowed(current.getStatus(), target) || !guard.test(current)) {
                log.debug("Transition {} -> {} refused for intent {}", current.getStatus(), target, intentId);
                return Optional.empty();
            }
            Query query = new Query(where("_id").is(intentId)
                    .and("status").is(current.getStatus())
                    .and("revision").is(current.getRevision()));
            Update update = new Update()
                    .set("status", target)
                    .set("updatedAt", now)
                    .inc("revision", 1);
            if (current.getStatus() != target) {
                String noted = current.getStatus() == PaymentIntentStatus.EXPIRED ? reason + " (confirmedAfterExpiry)" : reason;
                update.push("statusHistory", new StatusChange(current.getStatus(), target, now, noted, txHash));
            }
            changes.accept(update);
            PaymentIntent updated = mongoTemplate.findAndModify(query, update,
                    FindAndModifyOptions.options().returnNew(true), PaymentIntent.class);
            if (updated != null) {
                if (!Objects.equals(current.getStatus(), target)) {
                    log.info("Intent {} {} -> {} ({})", intentId, current.getStatus(), target, reason);
                }
                return Optional.of(updated);
            }
        }
        log.warn("Intent {} transition to {} lost {} races; giving up", intentId, target, MAX_CAS_ATTEMPTS);
        return Optional.empty();
    }

    /** The sweeper expired the intent while a verification started at {@code startedAt} was in flight. */
    private static boolean expiredDuring(PaymentIntent current, Instant startedAt) {
        return current.getExpiredAt() != null && startedAt != null && !current.getExpiredAt().isBefore(startedAt);
    }

    private static EnumSet<PaymentIntentStatus> terminalStatuses() {
        EnumSet<PaymentIntentStatus> terminal = EnumSet.noneOf(PaymentIntentStatus.class);
        for (PaymentIntentStatus s : PaymentIntentStatus.values()) {
            if (s.isTerminal()) {
                terminal.add(s);
            }
        }
        return terminal;
    }
}
