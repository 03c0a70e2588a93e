package com.chaintruth.chain.facts;

import java.math.BigInteger;
import java.util.List;

/**
 * getTransaction result: account keys (static + loaded), lamport and token balances before/after.
 *
 * @param slot   null when not yet in a block
 * @param failed meta.err was not null
 */
public record SolanaTxFacts(
        String txHash,
        Long slot,
        boolean failed,
        List<String> accountKeys,
        List<BigInteger> preBalances,
        List<BigInteger> postBalances,
        List<TokenBalance> preTokenBalances,
        List<TokenBalance> postTokenBalances
) implements ChainTxFacts {

    public SolanaTxFacts {
        accountKeys = accountKeys != null ? List.copyOf(accountKeys) : List.of();
        preBalances = preBalances != null ? List.copyOf(preBalances) : List.of();
        postBalances = postBalances != null ? List.copyOf(postBalances) : List.of();
        preTokenBalances = preTokenBalances != null ? List.copyOf(preTokenBalances) : List.of();
        postTokenBalances = postTokenBalances != null ? List.copyOf(postTokenBalances) : List.of();
    }

    public record TokenBalance(int accountIndex, String mint, String owner, BigInteger amount) {
    }
}
