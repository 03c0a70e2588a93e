package com.chaintruth.chain.facts;

import java.math.BigInteger;
import java.util.List;

/**
 * eth_getTransactionByHash + eth_getTransactionReceipt.
 *
 * @param blockNumber   null while pending
 * @param receiptStatus null while pending (no receipt), false when reverted
 */
public record EvmTxFacts(
        String txHash,
        String from,
        String to,
        BigInteger value,
        String input,
        Long blockNumber,
        Boolean receiptStatus,
        List<Log> logs
) implements ChainTxFacts {

    public EvmTxFacts {
        logs = logs != null ? List.copyOf(logs) : List.of();
    }

    public record Log(String address, List<String> topics, String data) {

        public Log {
            topics = topics != null ? List.copyOf(topics) : List.of();
        }
    }
}
