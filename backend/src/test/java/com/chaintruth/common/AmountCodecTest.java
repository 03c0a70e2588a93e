package com.chaintruth.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AmountCodecTest {

    @Test
    void toNative_ethAmount() {
        assertThat(AmountCodec.toNative("0.05", 18)).isEqualTo(new BigInteger("50000000000000000"));
    }

    @Test
    void toNative_truncatesExtraFractionDigits() {
        assertThat(AmountCodec.toNative("1.1234567", 6)).isEqualTo(BigInteger.valueOf(1_123_456L));
    }

    @Test
    void toNative_acceptsLeadingOrTrailingDot() {
        assertThat(AmountCodec.toNative(".5", 8)).isEqualTo(BigInteger.valueOf(50_000_000L));
        assertThat(AmountCodec.toNative("2.", 2)).isEqualTo(BigInteger.valueOf(200L));
    }

    @Test
    void toNative_zeroDecimals() {
        assertThat(AmountCodec.toNative("42", 0)).isEqualTo(BigInteger.valueOf(42L));
        assertThat(AmountCodec.toNative("42.9", 0)).isEqualTo(BigInteger.valueOf(42L));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", ".", "-1", "1e5", "abc", "1.2.3", "1,5"})
    void toNative_malformed_throws(String input) {
        assertThatThrownBy(() -> AmountCodec.toNative(input, 18)).isInstanceOf(MalformedAmountException.class);
    }

    @Test
    void toNative_null_throws() {
        assertThatThrownBy(() -> AmountCodec.toNative((String) null, 18)).isInstanceOf(MalformedAmountException.class);
    }

    @Test
    @DisplayName("display string survives conversion for every decimals value in 0..18")
    void roundTrip_acrossDecimals() {
        for (int d = 0; d <= 18; d++) {
            String display = d == 0 ? "123" : "123." + "1".repeat(d);
            BigInteger raw = AmountCodec.toNative(display, d);
            assertThat(AmountCodec.fromNative(raw, d)).isEqualTo(display);
        }
    }

    @ParameterizedTest
    @MethodSource("rawAmounts")
    @DisplayName("raw amount survives display formatting and parsing")
    void rawRoundTrip(BigInteger raw, int decimals) {
        assertThat(AmountCodec.toNative(AmountCodec.fromNative(raw, decimals), decimals)).isEqualTo(raw);
    }

    static Stream<Arguments> rawAmounts() {
        Random random = new Random(20250601L);
        List<Arguments> cases = new ArrayList<>();
        for (int d = 0; d <= 18; d++) {
            BigInteger scale = BigInteger.TEN.pow(d);
            cases.add(Arguments.of(BigInteger.ZERO, d));
            cases.add(Arguments.of(BigInteger.ONE, d));
            cases.add(Arguments.of(scale, d));
            cases.add(Arguments.of(scale.multiply(BigInteger.valueOf(1_000)), d));
            cases.add(Arguments.of(new BigInteger("50000000000000000"), d));
            cases.add(Arguments.of(new BigInteger("123456789012345678901234567890"), d));
            for (int i = 0; i < 40; i++) {
                cases.add(Arguments.of(new BigInteger(1 + random.nextInt(120), random), d));
            }
        }
        return cases.stream();
    }

    @Test
    void fromNative_stripsTrailingZeros() {
        assertThat(AmountCodec.fromNative(new BigInteger("50000000000000000"), 18)).isEqualTo("0.05");
        assertThat(AmountCodec.fromNative(BigInteger.valueOf(100_000_000L), 8)).isEqualTo("1");
        assertThat(AmountCodec.fromNative(BigInteger.ZERO, 8)).isEqualTo("0");
    }

    @Test
    void fromNative_negative_throws() {
        assertThatThrownBy(() -> AmountCodec.fromNative(BigInteger.valueOf(-1), 8))
                .isInstanceOf(MalformedAmountException.class);
    }

    @Test
    void toNative_bigDecimal_roundsDown() {
        assertThat(AmountCodec.toNative(new BigDecimal("0.123456789"), 6)).isEqualTo(BigInteger.valueOf(123_456L));
    }

    @Test
    void decimalsOutOfRange_throws() {
        assertThatThrownBy(() -> AmountCodec.toNative("1", -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AmountCodec.toNative("1", 37)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withNonce_replacesLowestDigits() {
        BigInteger expected = new BigInteger("50000000000000000");
        BigInteger nonced = AmountCodec.withNonce(expected, 6, 4321L);
        assertThat(nonced).isEqualTo(new BigInteger("50000000000004321"));
        assertThat(AmountCodec.extractNonce(nonced, 6)).isEqualTo(4321L);
    }

    @Test
    void withNonce_random_staysInsideWidth() {
        BigInteger expected = BigInteger.valueOf(10_000_000L);
        for (int i = 0; i < 50; i++) {
            BigInteger nonced = AmountCodec.withNonce(expected, 3);
            assertThat(AmountCodec.extractNonce(nonced, 3)).isBetween(0L, 999L);
            assertThat(nonced.divide(BigInteger.valueOf(1000))).isEqualTo(BigInteger.valueOf(10_000L));
        }
    }

    @Test
    @DisplayName("nonce draws cover the whole range including zero")
    void drawNonce_coversFullRange() {
        Set<Long> seen = new HashSet<>();
        for (int i = 0; i < 2_000; i++) {
            long nonce = AmountCodec.drawNonce(1);
            assertThat(nonce).isBetween(0L, 9L);
            seen.add(nonce);
        }
        assertThat(seen).hasSize(10);
    }

    @Test
    void withNonce_nonceTooWide_throws() {
        assertThatThrownBy(() -> AmountCodec.withNonce(BigInteger.valueOf(1_000_000L), 2, 100L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withNonce_zeroWidth_returnsInput() {
        BigInteger expected = BigInteger.valueOf(12345L);
        assertThat(AmountCodec.withNonce(expected, 0)).isSameAs(expected);
    }

    @Test
    void matches_isExact() {
        BigInteger expected = new BigInteger("50000000000004321");
        assertThat(AmountCodec.matches(new BigInteger("50000000000004321"), expected)).isTrue();
        assertThat(AmountCodec.matches(new BigInteger("50000000000004322"), expected)).isFalse();
        assertThat(AmountCodec.matches(null, expected)).isFalse();
    }

    @Test
    void withinNonceBand_onlyLowDigitsDiffer() {
        BigInteger expected = new BigInteger("50000000000004321");
        assertThat(AmountCodec.withinNonceBand(new BigInteger("50000000000009999"), expected, 6)).isTrue();
        assertThat(AmountCodec.withinNonceBand(new BigInteger("40000000000004321"), expected, 6)).isFalse();
    }
}
