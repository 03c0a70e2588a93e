package com.chaintruth.ledger;

import com.chaintruth.domain.ChainTransactionRecordRepository;
import com.chaintruth.domain.DonationLedgerEntry;
import com.chaintruth.domain.DonationLedgerRepository;
import com.chaintruth.domain.PaymentIntent;
import com.chaintruth.domain.PaymentIntentRepository;
import com.chaintruth.domain.PaymentIntentStatus;
import com.chaintruth.pricing.FiatRateProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@SpringBootTest(properties = {
        "chaintruth.intent.sweep-initial-delay-ms=3600000",
        "chaintruth.intent.confirmation-poll-initial-delay-ms=3600000"
})
@Testcontainers(disabledWithoutDocker = true)
class ReconciliationIntegrationTest {

    private static final String DEPOSIT = "0x742d35cc6634c0532925a3b844bc454e4438f44e";
    private static final BigInteger AMOUNT = new BigInteger("50000000000123456");

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    ReconciliationCommitter committer;
    @Autowired
    CampaignTotalsService totalsService;
    @Autowired
    PaymentIntentRepository intentRepository;
    @Autowired
    DonationLedgerRepository ledgerRepository;
    @Autowired
    ChainTransactionRecordRepository chainTransactionRepository;

    @MockBean
    FiatRateProvider fiatRateProvider;

    @BeforeEach
    void setUp() {
        when(fiatRateProvider.currency()).thenReturn("usd");
        when(fiatRateProvider.currentRate(any())).thenReturn(Optional.of(new BigDecimal("3000")));
    }

    @Test
    @DisplayName("same tx committed twice yields one ledger entry, one totals increment and alreadyRecorded")
    void commitTwice_singleLedgerEntry() {
        String campaignId = "campaign-" + UUID.randomUUID();
        PaymentIntent intent = intentRepository.insert(intent(campaignId, PaymentIntentStatus.DETECTING));
        String txHash = "0x" + "a1".repeat(32);

        CommitResult first = committer.commit(intent.getId(), "ethereum", txHash, facts());
        CommitResult second = committer.commit(intent.getId(), "ethereum", txHash, facts());

        assertThat(first.kind()).isEqualTo(CommitResult.Kind.RECORDED);
        assertThat(second.kind()).isEqualTo(CommitResult.Kind.ALREADY_RECORDED);
        assertThat(second.donationId()).isEqualTo(first.donationId());
        assertThat(ledgerRepository.countByNetworkIdAndTxHash("ethereum", txHash)).isEqualTo(1);

        DonationLedgerEntry entry = ledgerRepository.findById(first.donationId()).orElseThrow();
        assertThat(entry.getAmountNative()).isEqualTo("0.050000000000123456");
        assertThat(entry.getFiatRate()).isEqualByComparingTo("3000");
        assertThat(entry.isConfirmedAfterExpiry()).isFalse();

        PaymentIntent confirmed = intentRepository.findById(intent.getId()).orElseThrow();
        assertThat(confirmed.getStatus()).isEqualTo(PaymentIntentStatus.CONFIRMED);
        assertThat(confirmed.getDonationId()).isEqualTo(first.donationId());
        assertThat(chainTransactionRepository.findById("ethereum:" + txHash)).get()
                .satisfies(record -> assertThat(record.getIntentId()).isEqualTo(intent.getId()));

        CampaignTotalsView totals = totalsService.totals(campaignId).orElseThrow();
        assertThat(totals.donationCount()).isEqualTo(1);
        assertThat(totals.raisedByAsset()).containsEntry("eth_ethereum_mainnet", "0.050000000000123456");
        assertThat(totals.raisedFiat()).isEqualByComparingTo("150");
        assertThat(totals.fiatCurrency()).isEqualTo("usd");
    }

    @Test
    @DisplayName("a tx recorded for one intent cannot be committed for another")
    void otherIntent_getsExistingDonation() {
        String campaignId = "campaign-" + UUID.randomUUID();
        PaymentIntent a = intentRepository.insert(intent(campaignId, PaymentIntentStatus.DETECTING));
        PaymentIntent b = intentRepository.insert(intent(campaignId, PaymentIntentStatus.DETECTING));
        String txHash = "0x" + "b2".repeat(32);

        committer.commit(a.getId(), "ethereum", txHash, facts());
        committer.commit(b.getId(), "ethereum", txHash, facts());

        assertThat(intentRepository.findById(b.getId()).orElseThrow().getStatus()).isEqualTo(PaymentIntentStatus.DETECTING);
        assertThat(totalsService.totals(campaignId).orElseThrow().donationCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("unpriced commit counts the donation without fiat value")
    void unpricedCommit() {
        when(fiatRateProvider.currentRate(any())).thenReturn(Optional.empty());
        String campaignId = "campaign-" + UUID.randomUUID();
        PaymentIntent intent = intentRepository.insert(intent(campaignId, PaymentIntentStatus.CONFIRMING));
        String txHash = "0x" + "c3".repeat(32);
        intent.setCandidateTxHash(txHash);
        intentRepository.save(intent);

        CommitResult result = committer.commit(intent.getId(), "ethereum", txHash, facts());

        assertThat(result.kind()).isEqualTo(CommitResult.Kind.RECORDED);
        CampaignTotalsView totals = totalsService.totals(campaignId).orElseThrow();
        assertThat(totals.unpricedCount()).isEqualTo(1);
        assertThat(totals.raisedFiat()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("closed intent is not committable and nothing is written")
    void expiredIntent_notCommittable() {
        String campaignId = "campaign-" + UUID.randomUUID();
        PaymentIntent intent = intent(campaignId, PaymentIntentStatus.EXPIRED);
        intent.setExpiredAt(Instant.now().minusSeconds(600));
        intentRepository.insert(intent);
        String txHash = "0x" + "d4".repeat(32);

        CommitResult result = committer.commit(intent.getId(), "ethereum", txHash, facts());

        assertThat(result.kind()).isEqualTo(CommitResult.Kind.INTENT_NOT_COMMITTABLE);
        assertThat(ledgerRepository.countByNetworkIdAndTxHash("ethereum", txHash)).isZero();
        assertThat(totalsService.totals(campaignId)).isEmpty();
        assertThat(chainTransactionRepository.findById("ethereum:" + txHash)).isEmpty();
    }

    @Test
    @DisplayName("intent swept while its verification was in flight is still recorded and marked late")
    void expiredAfterVerificationStarted_recorded() {
        String campaignId = "campaign-" + UUID.randomUUID();
        PaymentIntent intent = intentRepository.insert(intent(campaignId, PaymentIntentStatus.DETECTING));
        String txHash = "0x" + "e5".repeat(32);
        VerifiedChainFacts facts = facts();
        intentRepository.markExpired(intent.getId(), intent.getExpiresAt().plusSeconds(1)).orElseThrow();

        CommitResult result = committer.commit(intent.getId(), "ethereum", txHash, facts);

        assertThat(result.kind()).isEqualTo(CommitResult.Kind.RECORDED);
        assertThat(ledgerRepository.findById(result.donationId()).orElseThrow().isConfirmedAfterExpiry()).isTrue();
        assertThat(intentRepository.findById(intent.getId()).orElseThrow().getStatus())
                .isEqualTo(PaymentIntentStatus.CONFIRMED);
    }

    private static VerifiedChainFacts facts() {
        return new VerifiedChainFacts("0x1111111111111111111111111111111111111111", DEPOSIT, AMOUNT, 19_000_100L, 20,
                "https://etherscan.io/tx/x", Instant.now());
    }

    private static PaymentIntent intent(String campaignId, PaymentIntentStatus status) {
        Instant now = Instant.now();
        PaymentIntent intent = new PaymentIntent();
        intent.setId(UUID.randomUUID().toString().replace("-", ""));
        intent.setCampaignId(campaignId);
        intent.setNetworkId("ethereum");
        intent.setAssetId("eth_ethereum_mainnet");
        intent.setDecimals(18);
        intent.setExpectedAmountRaw(AMOUNT);
        intent.setExpectedAmountNative("0.050000000000123456");
        intent.setNonceWidth(6);
        intent.setDepositAddress(DEPOSIT);
        intent.setStartBlock(19_000_000L);
        intent.setExpiresAt(now.plusSeconds(1800));
        intent.setStatus(status);
        intent.setCreatedAt(now);
        intent.setUpdatedAt(now);
        return intent;
    }
}
