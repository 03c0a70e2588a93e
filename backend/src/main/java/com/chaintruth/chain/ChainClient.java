package com.chaintruth.chain;

import com.chaintruth.chain.facts.ChainTxFacts;
import com.chaintruth.domain.NetworkFamily;
import com.chaintruth.registry.NetworkDefinition;

import java.util.Optional;

/**
 * Raw chain facts for one network family. Implementations make one attempt per call;
 * retries belong to the caller.
 */
public interface ChainClient {

    boolean supports(NetworkFamily family);

    /**
     * Facts for a normalized transaction hash, or empty when the network does not know the transaction.
     *
     * @throws RpcException when the data source is unavailable or returns an error
     */
    Optional<ChainTxFacts> fetchTransaction(NetworkDefinition network, String txHash);

    /**
     * Current chain head (block number or slot).
     *
     * @throws RpcException when the data source is unavailable or returns an error
     */
    long currentHeight(NetworkDefinition network);
}
