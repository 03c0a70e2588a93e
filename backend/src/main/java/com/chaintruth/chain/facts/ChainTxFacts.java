package com.chaintruth.chain.facts;

/**
 * Raw facts about one transaction as a chain family reports them. Business rules never read these directly;
 * {@link ChainFactsNormalizer} turns them into a {@link NormalizedChainTx} first.
 */
public sealed interface ChainTxFacts permits EvmTxFacts, UtxoTxFacts, SolanaTxFacts {

    String txHash();
}
