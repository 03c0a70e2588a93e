package com.chaintruth.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Chain data source config: RPC URLs per network id, indexer base URL, timeouts and the local request budget.
 */
@ConfigurationProperties(prefix = "chaintruth.chain")
@NoArgsConstructor
@Getter
@Setter
public class ChainNetworkProperties {

    /** Key: registry network id. Networks without urls cannot be verified (RpcUnavailable). */
    private Map<String, NetworkRpcEntry> network = new HashMap<>();

    /** Blockchair-compatible REST base URL for UTXO networks. */
    private String utxoApiBaseUrl = "https://api.blockchair.com";

    /** Per-call timeout for RPC and indexer requests. */
    private long requestTimeoutMs = 10_000L;

    /** Local budget across all chain calls. */
    private int maxRequestsPerSecond = 20;

    /** How long a caller may wait for the local budget before failing the call. */
    private long localLimiterTimeoutMs = 2_000L;

    public void setNetwork(Map<String, NetworkRpcEntry> network) {
        this.network = network != null ? network : new HashMap<>();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class NetworkRpcEntry {

        private List<String> urls = new ArrayList<>();

        public void setUrls(List<String> urls) {
            this.urls = urls != null ? urls : new ArrayList<>();
        }
    }
}
