package com.chaintruth.chain.solana;

import reactor.core.publisher.Mono;

/**
 * Solana JSON-RPC transport. Same JSON-RPC 2.0 envelope as EVM.
 */
public interface SolanaRpcClient {

    Mono<String> call(String endpointUrl, String method, Object params);
}
