package com.chaintruth.intent;

import com.chaintruth.chain.ChainClientDispatcher;
import com.chaintruth.common.AmountCodec;
import com.chaintruth.domain.IntentNotFoundException;
import com.chaintruth.domain.PaymentIntent;
import com.chaintruth.domain.PaymentIntentRepository;
import com.chaintruth.domain.PaymentIntentStatus;
import com.chaintruth.domain.StatusChange;
import com.chaintruth.intent.config.IntentProperties;
import com.chaintruth.pricing.FiatRateProvider;
import com.chaintruth.registry.AssetDefinition;
import com.chaintruth.registry.AssetNetworkRegistry;
import com.chaintruth.registry.NetworkDefinition;
import com.chaintruth.registry.PaymentUriBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Creates intents and serves them back. Expectation fields (amount, address, replay guard, expiry) are fixed here
 * and never written again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentIntentService {

    private static final EnumSet<PaymentIntentStatus> OPEN = EnumSet.of(
            PaymentIntentStatus.CREATED, PaymentIntentStatus.DETECTING, PaymentIntentStatus.CONFIRMING);

    private final AssetNetworkRegistry registry;
    private final PaymentIntentRepository intentRepository;
    private final DepositAddressProvider depositAddressProvider;
    private final ChainClientDispatcher clientDispatcher;
    private final FiatRateProvider fiatRateProvider;
    private final PaymentUriBuilder paymentUriBuilder;
    private final IntentProperties intentProperties;
    private final Clock clock;

    /**
     * @throws com.chaintruth.registry.UnknownNetworkException       unknown network
     * @throws com.chaintruth.registry.UnknownAssetException         unknown asset or asset not on the network
     * @throws com.chaintruth.common.MalformedAmountException        unparseable native amount
     * @throws InvalidIntentRequestException                         inconsistent request
     * @throws FiatRateUnavailableException                          USD amount without a current rate
     * @throws DepositAddressUnavailableException                    no usable deposit address
     * @throws com.chaintruth.chain.RpcException                     chain head unavailable for the replay guard
     */
    public PaymentIntent create(CreateIntentCommand command) {
        if (command.campaignId() == null || command.campaignId().isBlank()) {
            throw new InvalidIntentRequestException("campaignId is required");
        }
        NetworkDefinition network = registry.network(command.networkId());
        AssetDefinition asset = registry.assetOnNetwork(command.assetId(), command.networkId());
        boolean byUsd = command.amountUsd() != null;
        boolean byNative = command.amountNative() != null && !command.amountNative().isBlank();
        if (byUsd == byNative) {
            throw new InvalidIntentRequestException("Exactly one of amountUsd and amountNative is required");
        }

        BigInteger requestedRaw;
        BigDecimal rate;
        BigDecimal amountUsd;
        if (byUsd) {
            if (command.amountUsd().signum() <= 0) {
                throw new InvalidIntentRequestException("amountUsd must be positive");
            }
            rate = fiatRateProvider.currentRate(asset).orElseThrow(() -> new FiatRateUnavailableException(asset.id()));
            requestedRaw = AmountCodec.toNative(command.amountUsd().divide(rate, asset.decimals() + 4, RoundingMode.DOWN), asset.decimals());
            amountUsd = command.amountUsd();
        } else {
            requestedRaw = AmountCodec.toNative(command.amountNative(), asset.decimals());
            rate = fiatRateProvider.currentRate(asset).orElse(null);
            amountUsd = rate != null
                    ? new BigDecimal(requestedRaw, asset.decimals()).multiply(rate).setScale(2, RoundingMode.HALF_UP)
                    : null;
        }
        BigInteger minimum = BigInteger.TEN.pow(asset.nonceWidth()).multiply(BigInteger.valueOf(intentProperties.getMinAmountNonceFactor()));
        if (requestedRaw.compareTo(minimum) < 0) {
            throw new InvalidIntentRequestException("Amount too small for " + asset.id() + "; minimum is "
                    + AmountCodec.fromNative(minimum, asset.decimals()));
        }

        String depositAddress = depositAddressProvider.depositAddress(command.campaignId(), network, asset);
        long startBlock = clientDispatcher.forNetwork(network).currentHeight(network);
        BigInteger expectedRaw = drawNoncedAmount(network, depositAddress, asset, requestedRaw);
        String expectedNative = AmountCodec.fromNative(expectedRaw, asset.decimals());

        Instant now = clock.instant();
        PaymentIntent intent = new PaymentIntent();
        intent.setId(UUID.randomUUID().toString().replace("-", ""));
        intent.setCampaignId(command.campaignId().strip());
        intent.setDonorRef(command.donorRef());
        intent.setNetworkId(network.id());
        intent.setAssetId(asset.id());
        intent.setDecimals(asset.decimals());
        intent.setRequestedAmountNative(AmountCodec.fromNative(requestedRaw, asset.decimals()));
        intent.setExpectedAmountNative(expectedNative);
        intent.setExpectedAmountRaw(expectedRaw);
        intent.setNonceWidth(asset.nonceWidth());
        intent.setAmountUsd(amountUsd);
        intent.setFxRate(rate);
        intent.setDepositAddress(depositAddress);
        intent.setStartBlock(startBlock);
        intent.setExpiresAt(now.plus(intentProperties.getExpiry()));
        intent.setPaymentUri(paymentUriBuilder.build(network, asset, depositAddress, expectedNative));
        intent.setStatus(PaymentIntentStatus.CREATED);
        intent.getStatusHistory().add(new StatusChange(null, PaymentIntentStatus.CREATED, now, "created", null));
        intent.setCreatedAt(now);
        intent.setUpdatedAt(now);
        PaymentIntent saved = intentRepository.insert(intent);
        log.info("Created intent {} for campaign {}: {} {} to {} on {} (startBlock {})", saved.getId(), saved.getCampaignId(),
                expectedNative, asset.symbol(), depositAddress, network.id(), startBlock);
        return saved;
    }

    public PaymentIntent get(String intentId) {
        return intentRepository.findById(intentId).orElseThrow(() -> new IntentNotFoundException(intentId));
    }

    public Optional<PaymentIntent> find(String intentId) {
        return intentRepository.findById(intentId);
    }

    /**
     * Nonced amount that no other open intent on the same address expects.
     */
    private BigInteger drawNoncedAmount(NetworkDefinition network, String depositAddress, AssetDefinition asset,
                                        BigInteger requestedRaw) {
        List<PaymentIntent> open = intentRepository.findByNetworkIdAndDepositAddressAndStatusIn(network.id(), depositAddress, OPEN);
        Set<BigInteger> taken = open.stream()
                .filter(i -> asset.id().equals(i.getAssetId()))
                .map(PaymentIntent::getExpectedAmountRaw)
                .collect(Collectors.toSet());
        for (int attempt = 0; attempt < Math.max(1, intentProperties.getNonceDrawAttempts()); attempt++) {
            BigInteger candidate = AmountCodec.withNonce(requestedRaw, asset.nonceWidth());
            if (!taken.contains(candidate)) {
                return candidate;
            }
            log.debug("Nonce collision on {} for {}; redrawing", depositAddress, asset.id());
        }
        throw new InvalidIntentRequestException("Too many open intents for this amount on " + network.id() + "; try a different amount");
    }
}
