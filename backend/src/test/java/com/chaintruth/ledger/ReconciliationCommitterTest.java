package com.chaintruth.ledger;

import com.chaintruth.domain.ChainTransactionRecord;
import com.chaintruth.domain.ChainTransactionRecordRepository;
import com.chaintruth.domain.PaymentIntent;
import com.chaintruth.domain.PaymentIntentRepository;
import com.chaintruth.domain.PaymentIntentStatus;
import com.chaintruth.pricing.FiatRateProvider;
import com.chaintruth.registry.TestCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ReconciliationCommitterTest {

    private static final String INTENT_ID = "intent-1";
    private static final String TX = "0x88df016429689c079f3b2f6ad39fa052532c56795b733da78a91ebe6a713944b";
    private static final String KEY = "ethereum:" + TX;
    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    @Mock
    private ChainTransactionRecordRepository chainTransactionRepository;
    @Mock
    private PaymentIntentRepository intentRepository;
    @Mock
    private LedgerWriter ledgerWriter;
    @Mock
    private FiatRateProvider fiatRateProvider;

    private ReconciliationCommitter committer;
    private PaymentIntent intent;
    private VerifiedChainFacts facts;

    @BeforeEach
    void setUp() {
        committer = new ReconciliationCommitter(chainTransactionRepository, intentRepository, ledgerWriter,
                fiatRateProvider, TestCatalog.registry(), Clock.fixed(NOW, ZoneOffset.UTC));
        intent = new PaymentIntent();
        intent.setId(INTENT_ID);
        intent.setCampaignId("campaign-1");
        intent.setNetworkId("ethereum");
        intent.setAssetId("eth_ethereum_mainnet");
        intent.setStatus(PaymentIntentStatus.DETECTING);
        facts = new VerifiedChainFacts("0xsender", TestCatalog.ETH_DEPOSIT, new BigInteger("50000000000000000"),
                1_000_050L, 12, "https://etherscan.io/tx/" + TX, NOW);

        when(intentRepository.findById(INTENT_ID)).thenReturn(Optional.of(intent));
        when(chainTransactionRepository.findById(KEY)).thenReturn(Optional.empty());
        when(fiatRateProvider.currency()).thenReturn("usd");
        when(fiatRateProvider.currentRate(TestCatalog.ETH)).thenReturn(Optional.of(new BigDecimal("3000")));
    }

    @Test
    @DisplayName("first commit writes the ledger entry with a frozen fiat snapshot")
    void firstCommit_recorded() {
        when(ledgerWriter.write(eq(intent), eq(TestCatalog.ETH), eq(TX), eq(facts), any(), eq(NOW))).thenReturn("donation-1");

        CommitResult result = committer.commit(INTENT_ID, "ethereum", TX, facts);

        assertThat(result.kind()).isEqualTo(CommitResult.Kind.RECORDED);
        assertThat(result.donationId()).isEqualTo("donation-1");
        ArgumentCaptor<FiatSnapshot> snapshot = ArgumentCaptor.forClass(FiatSnapshot.class);
        verify(ledgerWriter).write(eq(intent), eq(TestCatalog.ETH), eq(TX), eq(facts), snapshot.capture(), eq(NOW));
        assertThat(snapshot.getValue().currency()).isEqualTo("usd");
        assertThat(snapshot.getValue().value()).isEqualByComparingTo("150");
    }

    @Test
    @DisplayName("resubmitting a committed transaction returns alreadyRecorded and writes nothing")
    void secondCommit_alreadyRecorded() {
        ChainTransactionRecord recorded = new ChainTransactionRecord();
        recorded.setId(KEY);
        recorded.setIntentId(INTENT_ID);
        recorded.setDonationId("donation-1");
        when(chainTransactionRepository.findById(KEY)).thenReturn(Optional.of(recorded));

        CommitResult result = committer.commit(INTENT_ID, "ethereum", TX, facts);

        assertThat(result.isAlreadyRecorded()).isTrue();
        assertThat(result.donationId()).isEqualTo("donation-1");
        verifyNoInteractions(ledgerWriter);
    }

    @Test
    void claimedByOtherIntent_nothingWritten() {
        ChainTransactionRecord claimed = new ChainTransactionRecord();
        claimed.setId(KEY);
        claimed.setIntentId("intent-2");
        when(chainTransactionRepository.findById(KEY)).thenReturn(Optional.of(claimed));

        CommitResult result = committer.commit(INTENT_ID, "ethereum", TX, facts);

        assertThat(result.kind()).isEqualTo(CommitResult.Kind.CLAIMED_BY_OTHER);
        verifyNoInteractions(ledgerWriter);
    }

    @Test
    void noFiatRate_commitsUnpriced() {
        when(fiatRateProvider.currentRate(any())).thenReturn(Optional.empty());
        when(ledgerWriter.write(any(), any(), any(), any(), any(), any())).thenReturn("donation-1");

        committer.commit(INTENT_ID, "ethereum", TX, facts);

        ArgumentCaptor<FiatSnapshot> snapshot = ArgumentCaptor.forClass(FiatSnapshot.class);
        verify(ledgerWriter).write(any(), any(), any(), any(), snapshot.capture(), any());
        assertThat(snapshot.getValue().isPriced()).isFalse();
    }

    @Test
    @DisplayName("a concurrent commit that won the race is reported as alreadyRecorded")
    void lostRace_resolvedByReread() {
        ChainTransactionRecord recorded = new ChainTransactionRecord();
        recorded.setId(KEY);
        recorded.setIntentId(INTENT_ID);
        recorded.setDonationId("donation-winner");
        when(chainTransactionRepository.findById(KEY)).thenReturn(Optional.empty(), Optional.of(recorded));
        when(ledgerWriter.write(any(), any(), any(), any(), any(), any())).thenThrow(new ClaimConflictException(KEY));

        CommitResult result = committer.commit(INTENT_ID, "ethereum", TX, facts);

        assertThat(result.kind()).isEqualTo(CommitResult.Kind.ALREADY_RECORDED);
        assertThat(result.donationId()).isEqualTo("donation-winner");
    }

    @Test
    @DisplayName("a transaction recorded for another intent is never reported as this intent's donation")
    void recordedForOtherIntent_claimedByOther() {
        ChainTransactionRecord recorded = new ChainTransactionRecord();
        recorded.setId(KEY);
        recorded.setIntentId("intent-2");
        recorded.setDonationId("donation-other");
        when(chainTransactionRepository.findById(KEY)).thenReturn(Optional.of(recorded));

        CommitResult result = committer.commit(INTENT_ID, "ethereum", TX, facts);

        assertThat(result.kind()).isEqualTo(CommitResult.Kind.CLAIMED_BY_OTHER);
        assertThat(result.donationId()).isNull();
        verifyNoInteractions(ledgerWriter);
    }

    @Test
    void lostRaceToOtherIntent_claimedByOther() {
        ChainTransactionRecord recorded = new ChainTransactionRecord();
        recorded.setId(KEY);
        recorded.setIntentId("intent-2");
        recorded.setDonationId("donation-other");
        when(chainTransactionRepository.findById(KEY)).thenReturn(Optional.empty(), Optional.of(recorded));
        when(ledgerWriter.write(any(), any(), any(), any(), any(), any())).thenThrow(new ClaimConflictException(KEY));

        CommitResult result = committer.commit(INTENT_ID, "ethereum", TX, facts);

        assertThat(result.kind()).isEqualTo(CommitResult.Kind.CLAIMED_BY_OTHER);
    }

    @Test
    void storageFailureWithoutWinner_rethrown() {
        when(ledgerWriter.write(any(), any(), any(), any(), any(), any()))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));

        assertThatThrownBy(() -> committer.commit(INTENT_ID, "ethereum", TX, facts))
                .isInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void intentRefusesConfirmation_notCommittable() {
        intent.setStatus(PaymentIntentStatus.MISMATCH);
        when(ledgerWriter.write(any(), any(), any(), any(), any(), any())).thenThrow(new IntentNotCommittableException(INTENT_ID));

        CommitResult result = committer.commit(INTENT_ID, "ethereum", TX, facts);

        assertThat(result.kind()).isEqualTo(CommitResult.Kind.INTENT_NOT_COMMITTABLE);
        assertThat(result.intentStatus()).isEqualTo(PaymentIntentStatus.MISMATCH);
    }

    @Test
    void networkMismatch_throws() {
        assertThatThrownBy(() -> committer.commit(INTENT_ID, "bitcoin", TX, facts))
                .isInstanceOf(IllegalArgumentException.class);
        verify(ledgerWriter, never()).write(any(), any(), any(), any(), any(), any());
    }

    @Test
    void fiatSnapshot_scalesValue() {
        FiatSnapshot snapshot = FiatSnapshot.of("usd", new BigDecimal("64000.5"), BigInteger.valueOf(12_345L), 8);
        assertThat(snapshot.value()).isEqualByComparingTo("7.90086173");
        assertThat(snapshot.value().scale()).isEqualTo(8);
    }
}
