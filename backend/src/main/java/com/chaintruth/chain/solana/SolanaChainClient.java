package com.chaintruth.chain.solana;

import com.chaintruth.chain.ChainClient;
import com.chaintruth.chain.JsonRpcResponses;
import com.chaintruth.chain.RpcEndpoints;
import com.chaintruth.chain.RpcException;
import com.chaintruth.chain.facts.ChainTxFacts;
import com.chaintruth.chain.facts.SolanaTxFacts;
import com.chaintruth.domain.NetworkFamily;
import com.chaintruth.registry.NetworkDefinition;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Solana chain facts via getTransaction (jsonParsed, versioned transactions) and getSlot.
 */
@Component
@Slf4j
public class SolanaChainClient implements ChainClient {

    private static final String COMMITMENT = "confirmed";

    private final SolanaRpcClient rpcClient;
    private final RpcEndpoints endpoints;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public SolanaChainClient(SolanaRpcClient rpcClient,
                             @Qualifier("solanaRpcEndpoints") RpcEndpoints endpoints,
                             @Qualifier("chainRpcRateLimiter") RateLimiter rateLimiter,
                             ObjectMapper objectMapper) {
        this.rpcClient = rpcClient;
        this.endpoints = endpoints;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean supports(NetworkFamily family) {
        return family == NetworkFamily.SOL;
    }

    @Override
    public Optional<ChainTxFacts> fetchTransaction(NetworkDefinition network, String signature) {
        String endpoint = endpoints.nextEndpoint(network.id());
        Map<String, Object> config = Map.of(
                "encoding", "jsonParsed",
                "commitment", COMMITMENT,
                "maxSupportedTransactionVersion", 0);
        JsonNode result = callRpc(endpoint, "getTransaction", List.of(signature, config));
        if (result.isNull()) {
            log.debug("{} unknown on {}", signature, network.id());
            return Optional.empty();
        }
        return Optional.of(toFacts(signature, result));
    }

    @Override
    public long currentHeight(NetworkDefinition network) {
        String endpoint = endpoints.nextEndpoint(network.id());
        JsonNode result = callRpc(endpoint, "getSlot", List.of(Map.of("commitment", COMMITMENT)));
        if (!result.canConvertToLong()) {
            throw new RpcException("getSlot invalid result: " + result);
        }
        return result.asLong();
    }

    static SolanaTxFacts toFacts(String signature, JsonNode result) {
        JsonNode meta = result.path("meta");
        boolean failed = !meta.path("err").isMissingNode() && !meta.path("err").isNull();
        Long slot = result.path("slot").canConvertToLong() ? result.path("slot").asLong() : null;

        List<String> keys = new ArrayList<>();
        for (JsonNode key : result.path("transaction").path("message").path("accountKeys")) {
            // jsonParsed returns objects {pubkey, signer, writable}; json encoding returns strings
            keys.add(key.isObject() ? key.path("pubkey").asText() : key.asText());
        }
        JsonNode loaded = meta.path("loadedAddresses");
        if (!keys.isEmpty() && loaded.isObject() && keys.size() < meta.path("preBalances").size()) {
            loaded.path("writable").forEach(k -> keys.add(k.asText()));
            loaded.path("readonly").forEach(k -> keys.add(k.asText()));
        }
        return new SolanaTxFacts(
                signature,
                slot,
                failed,
                keys,
                balances(meta.path("preBalances")),
                balances(meta.path("postBalances")),
                tokenBalances(meta.path("preTokenBalances")),
                tokenBalances(meta.path("postTokenBalances")));
    }

    private static List<BigInteger> balances(JsonNode node) {
        List<BigInteger> out = new ArrayList<>();
        node.forEach(n -> out.add(n.bigIntegerValue()));
        return out;
    }

    private static List<SolanaTxFacts.TokenBalance> tokenBalances(JsonNode node) {
        List<SolanaTxFacts.TokenBalance> out = new ArrayList<>();
        for (JsonNode b : node) {
            String amount = b.path("uiTokenAmount").path("amount").asText("0");
            out.add(new SolanaTxFacts.TokenBalance(
                    b.path("accountIndex").asInt(),
                    b.path("mint").asText(null),
                    b.path("owner").isMissingNode() ? null : b.path("owner").asText(null),
                    new BigInteger(amount.isEmpty() ? "0" : amount)));
        }
        return out;
    }

    private JsonNode callRpc(String endpoint, String method, Object params) {
        if (!rateLimiter.acquirePermission()) {
            throw new RpcException("Local limiter timeout before " + method + " on " + endpoint);
        }
        String json;
        try {
            json = rpcClient.call(endpoint, method, params).block();
        } catch (RpcException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RpcException(method + " failed on " + endpoint, e);
        }
        return JsonRpcResponses.result(objectMapper, json, method);
    }
}
