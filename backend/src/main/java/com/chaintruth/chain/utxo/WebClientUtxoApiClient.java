package com.chaintruth.chain.utxo;

import com.chaintruth.chain.RpcException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * UTXO indexer client using WebClient, with a per-call timeout.
 */
public class WebClientUtxoApiClient implements UtxoApiClient {

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientUtxoApiClient(WebClient.Builder builder, Duration timeout) {
        this.webClient = builder.build();
        this.timeout = timeout;
    }

    @Override
    public Mono<String> get(String url) {
        return webClient.get()
                .uri(url)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
                .onErrorMap(WebClientResponseException.class, e -> new RpcException(e.getMessage(), e))
                .onErrorMap(WebClientRequestException.class, e -> new RpcException(e.getMessage(), e))
                .onErrorMap(TimeoutException.class, e -> new RpcException("GET " + url + " timed out after " + timeout.toMillis() + " ms", e));
    }
}
