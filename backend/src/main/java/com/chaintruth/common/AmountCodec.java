package com.chaintruth.common;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Objects;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between native integer units (wei, satoshi, lamports) and decimal display strings,
 * and embeds the per-intent disambiguation nonce into the lowest digits of a raw amount.
 * <p>
 * Matching is always exact on the full raw integer; see {@link #matches(BigInteger, BigInteger)}.
 */
public final class AmountCodec {

    public static final int MAX_DECIMALS = 36;

    private static final Pattern DECIMAL = Pattern.compile("^(\\d*)(?:\\.(\\d*))?$");
    private static final Random NONCE_RANDOM = new SecureRandom();

    private AmountCodec() {
    }

    /**
     * Parses a decimal string into native units. Fraction digits beyond {@code decimals} are truncated,
     * shorter fractions are right-padded with zeros.
     *
     * @throws MalformedAmountException when the input is blank, negative or not numeric
     */
    public static BigInteger toNative(String decimalString, int decimals) {
        checkDecimals(decimals);
        if (decimalString == null || decimalString.isBlank()) {
            throw new MalformedAmountException("Amount is empty");
        }
        String s = decimalString.strip();
        Matcher m = DECIMAL.matcher(s);
        if (!m.matches()) {
            throw new MalformedAmountException("Amount is not a non-negative decimal: " + decimalString);
        }
        String whole = m.group(1);
        String fraction = m.group(2) != null ? m.group(2) : "";
        if (whole.isEmpty() && fraction.isEmpty()) {
            throw new MalformedAmountException("Amount has no digits: " + decimalString);
        }
        if (fraction.length() > decimals) {
            fraction = fraction.substring(0, decimals);
        } else if (fraction.length() < decimals) {
            fraction = fraction + "0".repeat(decimals - fraction.length());
        }
        String digits = (whole.isEmpty() ? "0" : whole) + fraction;
        return new BigInteger(digits);
    }

    /**
     * Formats native units as a plain decimal string with trailing fraction zeros removed.
     */
    public static String fromNative(BigInteger nativeAmount, int decimals) {
        checkDecimals(decimals);
        Objects.requireNonNull(nativeAmount, "nativeAmount");
        if (nativeAmount.signum() < 0) {
            throw new MalformedAmountException("Native amount must not be negative: " + nativeAmount);
        }
        if (nativeAmount.signum() == 0) {
            return "0";
        }
        return new BigDecimal(nativeAmount, decimals).stripTrailingZeros().toPlainString();
    }

    /**
     * Converts a decimal value (e.g. USD / rate) to native units, rounding down.
     */
    public static BigInteger toNative(BigDecimal amount, int decimals) {
        checkDecimals(decimals);
        if (amount == null || amount.signum() < 0) {
            throw new MalformedAmountException("Amount must be a non-negative number");
        }
        return amount.movePointRight(decimals).toBigInteger();
    }

    /**
     * Replaces the lowest {@code nonceWidth} digits of {@code expected} with a nonce drawn uniformly from
     * [0, 10^nonceWidth), so two independent draws collide with probability 10^-nonceWidth.
     */
    public static BigInteger withNonce(BigInteger expected, int nonceWidth) {
        if (nonceWidth <= 0) {
            return expected;
        }
        return withNonce(expected, nonceWidth, drawNonce(nonceWidth));
    }

    static long drawNonce(int nonceWidth) {
        if (nonceWidth > 18) {
            throw new IllegalArgumentException("nonceWidth too large: " + nonceWidth);
        }
        return NONCE_RANDOM.nextLong(BigInteger.TEN.pow(nonceWidth).longValueExact());
    }

    /**
     * Deterministic variant of {@link #withNonce(BigInteger, int)}; {@code nonce} must fit in {@code nonceWidth} digits.
     */
    public static BigInteger withNonce(BigInteger expected, int nonceWidth, long nonce) {
        Objects.requireNonNull(expected, "expected");
        if (expected.signum() < 0) {
            throw new MalformedAmountException("Expected amount must not be negative: " + expected);
        }
        if (nonceWidth <= 0) {
            return expected;
        }
        if (nonceWidth > 18) {
            throw new IllegalArgumentException("nonceWidth too large: " + nonceWidth);
        }
        BigInteger modulus = BigInteger.TEN.pow(nonceWidth);
        BigInteger nonceValue = BigInteger.valueOf(nonce);
        if (nonceValue.signum() < 0 || nonceValue.compareTo(modulus) >= 0) {
            throw new IllegalArgumentException("nonce " + nonce + " does not fit width " + nonceWidth);
        }
        return expected.divide(modulus).multiply(modulus).add(nonceValue);
    }

    /**
     * Lowest {@code nonceWidth} digits of a raw amount.
     */
    public static long extractNonce(BigInteger amount, int nonceWidth) {
        if (nonceWidth <= 0) {
            return 0L;
        }
        return amount.mod(BigInteger.TEN.pow(nonceWidth)).longValueExact();
    }

    /**
     * Exact equality on the full raw integer. No tolerance band.
     */
    public static boolean matches(BigInteger detected, BigInteger expected) {
        return detected != null && expected != null && detected.compareTo(expected) == 0;
    }

    /**
     * True when two amounts differ at most in their lowest {@code nonceWidth} digits, i.e. a different
     * nonce could explain the difference.
     */
    public static boolean withinNonceBand(BigInteger detected, BigInteger expected, int nonceWidth) {
        if (detected == null || expected == null) {
            return false;
        }
        if (nonceWidth <= 0) {
            return detected.equals(expected);
        }
        BigInteger modulus = BigInteger.TEN.pow(nonceWidth);
        return detected.divide(modulus).equals(expected.divide(modulus));
    }

    private static void checkDecimals(int decimals) {
        if (decimals < 0 || decimals > MAX_DECIMALS) {
            throw new IllegalArgumentException("decimals out of range: " + decimals);
        }
    }
}
