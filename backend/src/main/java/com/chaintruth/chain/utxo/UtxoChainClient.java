package com.chaintruth.chain.utxo;

import com.chaintruth.chain.ChainClient;
import com.chaintruth.chain.RpcException;
import com.chaintruth.chain.facts.ChainTxFacts;
import com.chaintruth.chain.facts.UtxoTxFacts;
import com.chaintruth.domain.NetworkFamily;
import com.chaintruth.registry.NetworkDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Bitcoin/Litecoin facts via the Blockchair dashboard API:
 * {@code /{chain}/dashboards/transaction/{hash}} and {@code /{chain}/stats}.
 */
@Component
@Slf4j
public class UtxoChainClient implements ChainClient {

    private final UtxoApiClient apiClient;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public UtxoChainClient(UtxoApiClient apiClient,
                           @Qualifier("chainRpcRateLimiter") RateLimiter rateLimiter,
                           ObjectMapper objectMapper,
                           @Value("${chaintruth.chain.utxo-api-base-url:https://api.blockchair.com}") String baseUrl) {
        this.apiClient = apiClient;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public boolean supports(NetworkFamily family) {
        return family == NetworkFamily.UTXO;
    }

    @Override
    public Optional<ChainTxFacts> fetchTransaction(NetworkDefinition network, String txHash) {
        String url = baseUrl + "/" + chain(network) + "/dashboards/transaction/" + txHash;
        JsonNode root = get(url);
        if (root == null) {
            return Optional.empty();
        }
        JsonNode entry = root.path("data").path(txHash);
        if (entry.isMissingNode() || entry.isNull() || entry.path("transaction").isMissingNode()) {
            log.debug("{} unknown on {}", txHash, network.id());
            return Optional.empty();
        }
        return Optional.of(toFacts(txHash, entry));
    }

    @Override
    public long currentHeight(NetworkDefinition network) {
        JsonNode root = get(baseUrl + "/" + chain(network) + "/stats");
        if (root == null) {
            throw new RpcException("No stats for " + network.id());
        }
        JsonNode data = root.path("data");
        if (data.path("best_block_height").canConvertToLong()) {
            return data.path("best_block_height").asLong();
        }
        if (data.path("blocks").canConvertToLong()) {
            return data.path("blocks").asLong() - 1;
        }
        throw new RpcException("Stats for " + network.id() + " carry no block height");
    }

    static UtxoTxFacts toFacts(String txHash, JsonNode entry) {
        long blockId = entry.path("transaction").path("block_id").asLong(-1);
        List<String> inputs = new ArrayList<>();
        for (JsonNode in : entry.path("inputs")) {
            String address = in.path("recipient").asText(null);
            if (address != null && !inputs.contains(address)) {
                inputs.add(address);
            }
        }
        List<UtxoTxFacts.Output> outputs = new ArrayList<>();
        for (JsonNode out : entry.path("outputs")) {
            String address = out.path("recipient").asText(null);
            outputs.add(new UtxoTxFacts.Output(address, out.path("value").bigIntegerValue()));
        }
        return new UtxoTxFacts(txHash, blockId >= 0 ? blockId : null, inputs, outputs);
    }

    private JsonNode get(String url) {
        if (!rateLimiter.acquirePermission()) {
            throw new RpcException("Local limiter timeout before GET " + url);
        }
        String json;
        try {
            json = apiClient.get(url).block();
        } catch (RpcException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RpcException("GET " + url + " failed", e);
        }
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + url, e);
        }
    }

    private static String chain(NetworkDefinition network) {
        if (network.apiChain() == null) {
            throw new RpcException("Network " + network.id() + " has no indexer chain slug");
        }
        return network.apiChain();
    }
}
