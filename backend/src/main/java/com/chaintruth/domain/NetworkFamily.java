package com.chaintruth.domain;

import java.util.Locale;

/**
 * Chain family. Decides hash format, address comparison and which chain client serves a network.
 */
public enum NetworkFamily {
    EVM,
    UTXO,
    SOL;

    /**
     * Compares two addresses the way the family encodes them: EVM hex and bech32 are case-insensitive,
     * Base58 (legacy UTXO, Solana) is case-sensitive.
     */
    public boolean sameAddress(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        String left = a.strip();
        String right = b.strip();
        switch (this) {
            case EVM:
                return left.equalsIgnoreCase(right);
            case UTXO:
                if (isBech32(left) && isBech32(right)) {
                    return left.equalsIgnoreCase(right);
                }
                return left.equals(right);
            default:
                return left.equals(right);
        }
    }

    /**
     * Canonical form used for storage keys and lookups.
     */
    public String canonicalAddress(String address) {
        if (address == null) {
            return null;
        }
        String s = address.strip();
        if (this == EVM || (this == UTXO && isBech32(s))) {
            return s.toLowerCase(Locale.ROOT);
        }
        return s;
    }

    private static boolean isBech32(String address) {
        int sep = address.lastIndexOf('1');
        return sep > 0 && address.length() - sep > 6
                && (address.equals(address.toLowerCase(Locale.ROOT)) || address.equals(address.toUpperCase(Locale.ROOT)))
                && address.toLowerCase(Locale.ROOT).matches("^[a-z]{1,10}1[02-9ac-hj-np-z]+$");
    }
}
