package com.chaintruth.chain.utxo;

import reactor.core.publisher.Mono;

/**
 * HTTP GET against a UTXO indexer REST API. Completes empty on 404.
 */
public interface UtxoApiClient {

    Mono<String> get(String url);
}
