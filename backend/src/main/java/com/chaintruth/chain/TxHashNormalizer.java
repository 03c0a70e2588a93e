package com.chaintruth.chain;

import com.chaintruth.domain.NetworkFamily;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Canonical transaction identifiers per family:
 * EVM {@code 0x} + 64 lowercase hex (shorter hex is left-padded), UTXO 64 lowercase hex without prefix,
 * Solana Base58 signature of 32..88 characters (case preserved).
 */
public final class TxHashNormalizer {

    private static final Pattern HEX = Pattern.compile("^[0-9a-f]+$");
    private static final Pattern BASE58 = Pattern.compile("^[1-9A-HJ-NP-Za-km-z]{32,88}$");

    private TxHashNormalizer() {
    }

    /**
     * Empty when the input cannot be a hash for the family.
     */
    public static Optional<String> normalize(NetworkFamily family, String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String s = raw.strip();
        if (s.isEmpty()) {
            return Optional.empty();
        }
        switch (family) {
            case EVM:
                return normalizeEvm(s);
            case UTXO:
                return normalizeUtxo(s);
            case SOL:
                return BASE58.matcher(s).matches() ? Optional.of(s) : Optional.empty();
            default:
                return Optional.empty();
        }
    }

    private static Optional<String> normalizeEvm(String s) {
        String hex = s.toLowerCase(Locale.ROOT);
        if (hex.startsWith("0x")) {
            hex = hex.substring(2);
        }
        if (hex.isEmpty() || hex.length() > 64 || !HEX.matcher(hex).matches()) {
            return Optional.empty();
        }
        return Optional.of("0x" + "0".repeat(64 - hex.length()) + hex);
    }

    private static Optional<String> normalizeUtxo(String s) {
        String hex = s.toLowerCase(Locale.ROOT);
        if (hex.startsWith("0x")) {
            hex = hex.substring(2);
        }
        if (hex.length() != 64 || !HEX.matcher(hex).matches()) {
            return Optional.empty();
        }
        return Optional.of(hex);
    }
}
