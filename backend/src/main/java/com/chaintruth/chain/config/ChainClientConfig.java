package com.chaintruth.chain.config;

import com.chaintruth.chain.RpcEndpointRotator;
import com.chaintruth.chain.RpcEndpoints;
import com.chaintruth.chain.evm.EvmRpcClient;
import com.chaintruth.chain.evm.WebClientEvmRpcClient;
import com.chaintruth.chain.solana.SolanaRpcClient;
import com.chaintruth.chain.solana.WebClientSolanaRpcClient;
import com.chaintruth.chain.utxo.UtxoApiClient;
import com.chaintruth.chain.utxo.WebClientUtxoApiClient;
import com.chaintruth.common.RetryPolicy;
import com.chaintruth.domain.NetworkFamily;
import com.chaintruth.registry.AssetNetworkRegistry;
import com.chaintruth.registry.NetworkDefinition;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Chain clients and per-family endpoint rotators built from chaintruth.chain.network, keyed by registry network id.
 */
@Configuration
@EnableConfigurationProperties({ ChainNetworkProperties.class, ChainRetryProperties.class })
@Slf4j
public class ChainClientConfig {

    @Bean
    public RetryPolicy chainRetryPolicy(ChainRetryProperties properties) {
        return new RetryPolicy(properties.getBaseDelayMs(), properties.getJitterFactor(), properties.getMaxAttempts());
    }

    @Bean
    public RpcEndpoints evmRpcEndpoints(ChainNetworkProperties properties, AssetNetworkRegistry registry) {
        return endpointsFor(NetworkFamily.EVM, properties, registry);
    }

    @Bean
    public RpcEndpoints solanaRpcEndpoints(ChainNetworkProperties properties, AssetNetworkRegistry registry) {
        return endpointsFor(NetworkFamily.SOL, properties, registry);
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder, ChainNetworkProperties properties) {
        return new WebClientEvmRpcClient(webClientBuilder, Duration.ofMillis(properties.getRequestTimeoutMs()));
    }

    @Bean
    public SolanaRpcClient solanaRpcClient(WebClient.Builder webClientBuilder, ChainNetworkProperties properties) {
        return new WebClientSolanaRpcClient(webClientBuilder, Duration.ofMillis(properties.getRequestTimeoutMs()));
    }

    @Bean
    public UtxoApiClient utxoApiClient(WebClient.Builder webClientBuilder, ChainNetworkProperties properties) {
        return new WebClientUtxoApiClient(webClientBuilder, Duration.ofMillis(properties.getRequestTimeoutMs()));
    }

    @Bean(name = "chainRpcRateLimiter")
    public RateLimiter chainRpcRateLimiter(ChainNetworkProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("chain-rpc", config);
    }

    private static RpcEndpoints endpointsFor(NetworkFamily family, ChainNetworkProperties properties,
                                             AssetNetworkRegistry registry) {
        Map<String, RpcEndpointRotator> rotators = new HashMap<>();
        for (NetworkDefinition network : registry.networks()) {
            if (network.family() != family) {
                continue;
            }
            ChainNetworkProperties.NetworkRpcEntry entry = properties.getNetwork().get(network.id());
            if (entry == null || entry.getUrls().isEmpty()) {
                log.warn("No RPC urls for {} network {}; verification there will report RPC_UNAVAILABLE", family, network.id());
                continue;
            }
            rotators.put(network.id(), new RpcEndpointRotator(entry.getUrls()));
        }
        return new RpcEndpoints(rotators);
    }
}
