package com.chaintruth.intent;

import com.chaintruth.domain.PaymentIntent;
import com.chaintruth.domain.PaymentIntentRepository;
import com.chaintruth.intent.config.IntentProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Marks CREATED/DETECTING intents EXPIRED once expiresAt has passed. CONFIRMING and terminal intents are never
 * selected; each move is a conditional update, so an intent that advanced meanwhile is skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IntentExpirySweeper {

    private final PaymentIntentRepository intentRepository;
    private final IntentProperties intentProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${chaintruth.intent.sweep-interval-ms:60000}",
            initialDelayString = "${chaintruth.intent.sweep-initial-delay-ms:30000}")
    public void runScheduled() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Expiry sweep failed", e);
        }
    }

    /**
     * @return number of intents expired
     */
    public int sweep() {
        Instant now = clock.instant();
        List<PaymentIntent> candidates = intentRepository.findExpirable(now, intentProperties.getSweepBatchSize());
        int expired = 0;
        for (PaymentIntent candidate : candidates) {
            if (intentRepository.markExpired(candidate.getId(), now).isPresent()) {
                expired++;
            }
        }
        if (expired > 0) {
            log.info("Expired {} of {} overdue intents", expired, candidates.size());
        }
        return expired;
    }
}
