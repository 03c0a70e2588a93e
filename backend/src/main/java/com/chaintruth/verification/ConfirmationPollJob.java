package com.chaintruth.verification;

import com.chaintruth.config.AsyncConfig;
import com.chaintruth.domain.PaymentIntent;
import com.chaintruth.domain.PaymentIntentRepository;
import com.chaintruth.domain.PaymentIntentStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Re-polls CONFIRMING intents with their tracked transaction until they reach the network's threshold.
 * Earlier auto-attempts are ordinary CONFIRMING retries; commit happens only at or above the threshold.
 */
@Component
@Slf4j
public class ConfirmationPollJob {

    private final PaymentIntentRepository intentRepository;
    private final ChainTruthVerifier verifier;
    private final Executor executor;

    public ConfirmationPollJob(PaymentIntentRepository intentRepository,
                               ChainTruthVerifier verifier,
                               @Qualifier(AsyncConfig.VERIFICATION_EXECUTOR) Executor executor) {
        this.intentRepository = intentRepository;
        this.verifier = verifier;
        this.executor = executor;
    }

    @Scheduled(fixedDelayString = "${chaintruth.intent.confirmation-poll-interval-ms:30000}",
            initialDelayString = "${chaintruth.intent.confirmation-poll-initial-delay-ms:15000}")
    public void runScheduled() {
        try {
            poll();
        } catch (RuntimeException e) {
            log.error("Confirmation poll failed", e);
        }
    }

    /**
     * @return number of intents confirmed in this run
     */
    public int poll() {
        List<PaymentIntent> confirming = intentRepository.findByStatus(PaymentIntentStatus.CONFIRMING);
        if (confirming.isEmpty()) {
            return 0;
        }
        List<CompletableFuture<VerificationOutcome>> futures = confirming.stream()
                .filter(i -> i.getCandidateTxHash() != null)
                .map(i -> CompletableFuture.supplyAsync(() -> pollOne(i), executor))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        long confirmed = futures.stream()
                .map(CompletableFuture::join)
                .filter(o -> o != null && o.kind() == VerificationOutcome.Kind.CONFIRMED)
                .count();
        log.info("Confirmation poll: {} tracked, {} confirmed", futures.size(), confirmed);
        return (int) confirmed;
    }

    private VerificationOutcome pollOne(PaymentIntent intent) {
        try {
            return verifier.verify(intent.getId(), intent.getCandidateTxHash(), VerificationMode.PASSIVE);
        } catch (RuntimeException e) {
            log.warn("Re-poll of intent {} failed: {}", intent.getId(), e.getMessage());
            return null;
        }
    }
}
