package com.chaintruth.domain;

/**
 * How an asset moves on its network.
 */
public enum AssetType {
    /** Network coin: ETH, BNB, BTC, LTC, SOL. */
    NATIVE,
    /** ERC-20 contract on an EVM network. */
    ERC20,
    /** SPL token mint on Solana. */
    SPL;

    public boolean isToken() {
        return this != NATIVE;
    }
}
