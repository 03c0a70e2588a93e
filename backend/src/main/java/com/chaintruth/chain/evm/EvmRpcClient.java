package com.chaintruth.chain.evm;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC transport. Returns the raw response body; parsing belongs to {@link EvmChainClient}.
 */
public interface EvmRpcClient {

    Mono<String> call(String endpointUrl, String method, Object params);
}
