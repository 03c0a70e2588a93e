package com.chaintruth.chain.evm;

import com.chaintruth.chain.ChainClient;
import com.chaintruth.chain.JsonRpcResponses;
import com.chaintruth.chain.RpcEndpoints;
import com.chaintruth.chain.RpcException;
import com.chaintruth.chain.facts.ChainTxFacts;
import com.chaintruth.chain.facts.EvmTxFacts;
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
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * EVM chain facts via eth_getTransactionByHash, eth_getTransactionReceipt and eth_blockNumber.
 */
@Component
@Slf4j
public class EvmChainClient implements ChainClient {

    private final EvmRpcClient rpcClient;
    private final RpcEndpoints endpoints;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public EvmChainClient(EvmRpcClient rpcClient,
                          @Qualifier("evmRpcEndpoints") RpcEndpoints endpoints,
                          @Qualifier("chainRpcRateLimiter") RateLimiter rateLimiter,
                          ObjectMapper objectMapper) {
        this.rpcClient = rpcClient;
        this.endpoints = endpoints;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean supports(NetworkFamily family) {
        return family == NetworkFamily.EVM;
    }

    @Override
    public Optional<ChainTxFacts> fetchTransaction(NetworkDefinition network, String txHash) {
        String endpoint = endpoints.nextEndpoint(network.id());
        JsonNode tx = callRpc(endpoint, "eth_getTransactionByHash", List.of(txHash));
        if (tx.isNull()) {
            log.debug("{} unknown on {}", txHash, network.id());
            return Optional.empty();
        }
        JsonNode receipt = callRpc(endpoint, "eth_getTransactionReceipt", List.of(txHash));
        return Optional.of(toFacts(txHash, tx, receipt));
    }

    @Override
    public long currentHeight(NetworkDefinition network) {
        String endpoint = endpoints.nextEndpoint(network.id());
        JsonNode result = callRpc(endpoint, "eth_blockNumber", Collections.emptyList());
        Long height = hexToLong(result.asText(null));
        if (height == null) {
            throw new RpcException("eth_blockNumber invalid result: " + result);
        }
        return height;
    }

    static EvmTxFacts toFacts(String txHash, JsonNode tx, JsonNode receipt) {
        Long blockNumber = hexToLong(tx.path("blockNumber").asText(null));
        Boolean status = null;
        List<EvmTxFacts.Log> logs = new ArrayList<>();
        if (receipt != null && !receipt.isNull() && !receipt.isMissingNode()) {
            String statusHex = receipt.path("status").asText(null);
            // pre-Byzantium receipts carry no status; treat as success
            status = statusHex == null || !"0x0".equals(statusHex);
            Long receiptBlock = hexToLong(receipt.path("blockNumber").asText(null));
            if (receiptBlock != null) {
                blockNumber = receiptBlock;
            }
            for (JsonNode log : receipt.path("logs")) {
                List<String> topics = new ArrayList<>();
                log.path("topics").forEach(t -> topics.add(t.asText()));
                logs.add(new EvmTxFacts.Log(log.path("address").asText(null), topics, log.path("data").asText(null)));
            }
        }
        return new EvmTxFacts(
                txHash,
                textOrNull(tx.path("from")),
                textOrNull(tx.path("to")),
                hexToBigInteger(tx.path("value").asText(null)),
                textOrNull(tx.path("input")),
                blockNumber,
                status,
                logs);
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

    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    static Long hexToLong(String hex) {
        if (hex == null || !hex.startsWith("0x") || hex.length() < 3) {
            return null;
        }
        try {
            return Long.parseLong(hex.substring(2), 16);
        } catch (NumberFormatException e) {
            throw new RpcException("Malformed hex quantity from RPC: " + hex, e);
        }
    }

    static BigInteger hexToBigInteger(String hex) {
        if (hex == null || !hex.startsWith("0x") || hex.length() < 3) {
            return BigInteger.ZERO;
        }
        try {
            return new BigInteger(hex.substring(2), 16);
        } catch (NumberFormatException e) {
            throw new RpcException("Malformed hex quantity from RPC: " + hex, e);
        }
    }
}
