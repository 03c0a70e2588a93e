package com.chaintruth.verification;

import com.chaintruth.domain.PaymentIntent;
import com.chaintruth.domain.PaymentIntentRepository;
import com.chaintruth.domain.PaymentIntentStatus;
import com.chaintruth.registry.AssetNetworkRegistry;
import com.chaintruth.registry.NetworkDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;

/**
 * Turns watcher observations into PASSIVE verifications against every open intent on the observed address.
 * The amount nonce decides which intent (if any) the transaction belongs to; the first positive outcome ends the scan.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PassiveWatcherFeed {

    private static final EnumSet<PaymentIntentStatus> OPEN = EnumSet.of(
            PaymentIntentStatus.CREATED, PaymentIntentStatus.DETECTING, PaymentIntentStatus.CONFIRMING);

    private final AssetNetworkRegistry registry;
    private final PaymentIntentRepository intentRepository;
    private final ChainTruthVerifier verifier;

    /**
     * @throws com.chaintruth.registry.UnknownNetworkException when the observation names an unknown network
     */
    public List<VerificationOutcome> onObservation(WatcherObservation observation) {
        NetworkDefinition network = registry.network(observation.networkId());
        String address = network.family().canonicalAddress(observation.address());
        List<PaymentIntent> candidates = new ArrayList<>(
                intentRepository.findByNetworkIdAndDepositAddressAndStatusIn(network.id(), address, OPEN));
        candidates.sort(Comparator.comparing(PaymentIntent::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())));
        List<VerificationOutcome> outcomes = new ArrayList<>();
        for (PaymentIntent intent : candidates) {
            if (observation.blockHeight() != null) {
                intentRepository.advanceScanCursor(intent.getId(), network.id(), observation.blockHeight());
            }
            VerificationOutcome outcome = verifier.verify(intent.getId(), observation.txHash(), VerificationMode.PASSIVE);
            outcomes.add(outcome);
            if (!outcome.isRejected()) {
                log.info("Watcher tx {} on {} matched intent {} ({})", observation.txHash(), network.id(),
                        intent.getId(), outcome.kind());
                break;
            }
            if (outcome.isRetryable()) {
                // chain data unavailable; other intents would hit the same wall
                break;
            }
        }
        if (candidates.isEmpty()) {
            log.debug("Watcher tx {} on {}: no open intent on {}", observation.txHash(), network.id(), address);
        }
        return outcomes;
    }
}
