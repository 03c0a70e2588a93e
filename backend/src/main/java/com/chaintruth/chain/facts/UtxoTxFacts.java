package com.chaintruth.chain.facts;

import java.math.BigInteger;
import java.util.List;

/**
 * One UTXO transaction as reported by an indexer.
 *
 * @param blockHeight null while in the mempool
 */
public record UtxoTxFacts(
        String txHash,
        Long blockHeight,
        List<String> inputAddresses,
        List<Output> outputs
) implements ChainTxFacts {

    public UtxoTxFacts {
        inputAddresses = inputAddresses != null ? List.copyOf(inputAddresses) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }

    public record Output(String address, BigInteger value) {
    }
}
