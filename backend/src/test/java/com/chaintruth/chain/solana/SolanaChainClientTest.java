package com.chaintruth.chain.solana;

import com.chaintruth.chain.RpcEndpointRotator;
import com.chaintruth.chain.RpcEndpoints;
import com.chaintruth.chain.RpcException;
import com.chaintruth.chain.facts.SolanaTxFacts;
import com.chaintruth.registry.TestCatalog;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SolanaChainClientTest {

    private static final String SIG = "5VERv8NMvzbJMEkV8xnrLkEaWRtSz9CosKDYjCJjBRnbJLgp8uirBgmQpjKhoR4tjF3ZpRzrFmBV6UjKdiSZkQUW";

    private MockSolanaRpcClient mockRpc;
    private SolanaChainClient client;

    @BeforeEach
    void setUp() {
        mockRpc = new MockSolanaRpcClient();
        RpcEndpoints endpoints = new RpcEndpoints(Map.of("solana", new RpcEndpointRotator(List.of("https://sol.rpc"))));
        client = new SolanaChainClient(mockRpc, endpoints, RateLimiter.ofDefaults("test"), new ObjectMapper());
    }

    @Test
    void fetchTransaction_jsonParsedWithTokenBalances() {
        mockRpc.response = """
                {"jsonrpc":"2.0","id":1,"result":{"slot":250000000,
                  "transaction":{"message":{"accountKeys":[
                    {"pubkey":"Payer111111111111111111111111111111111111","signer":true,"writable":true},
                    {"pubkey":"9WzDXwBbmkg8ZTbNMqUxvQRAyrZzDsGYdLVL9zYtAWWM","signer":false,"writable":true}]}},
                  "meta":{"err":null,"preBalances":[5000000000,1000],"postBalances":[3999995000,1000001000],
                    "preTokenBalances":[],
                    "postTokenBalances":[{"accountIndex":2,"mint":"EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v",
                      "owner":"9WzDXwBbmkg8ZTbNMqUxvQRAyrZzDsGYdLVL9zYtAWWM","uiTokenAmount":{"amount":"25010000","decimals":6}}]}}}
                """;

        SolanaTxFacts facts = (SolanaTxFacts) client.fetchTransaction(TestCatalog.SOLANA, SIG).orElseThrow();

        assertThat(facts.slot()).isEqualTo(250_000_000L);
        assertThat(facts.failed()).isFalse();
        assertThat(facts.accountKeys()).containsExactly(
                "Payer111111111111111111111111111111111111", "9WzDXwBbmkg8ZTbNMqUxvQRAyrZzDsGYdLVL9zYtAWWM");
        assertThat(facts.postBalances()).containsExactly(BigInteger.valueOf(3_999_995_000L), BigInteger.valueOf(1_000_001_000L));
        assertThat(facts.postTokenBalances()).singleElement()
                .satisfies(b -> assertThat(b.amount()).isEqualTo(BigInteger.valueOf(25_010_000L)));
        assertThat(mockRpc.methods).containsExactly("getTransaction");
    }

    @Test
    void fetchTransaction_appendsLoadedAddresses() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        SolanaTxFacts facts = SolanaChainClient.toFacts(SIG, mapper.readTree("""
                {"slot":7,"transaction":{"message":{"accountKeys":["A","B"]}},
                 "meta":{"err":{"InstructionError":[0,"Custom"]},"preBalances":[1,2,3,4],"postBalances":[1,2,3,4],
                   "loadedAddresses":{"writable":["C"],"readonly":["D"]}}}
                """));

        assertThat(facts.accountKeys()).containsExactly("A", "B", "C", "D");
        assertThat(facts.failed()).isTrue();
    }

    @Test
    void fetchTransaction_unknownSignature_returnsEmpty() {
        mockRpc.response = "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}";
        assertThat(client.fetchTransaction(TestCatalog.SOLANA, SIG)).isEmpty();
    }

    @Test
    void currentHeight_readsSlot() {
        mockRpc.response = "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":250000040}";
        assertThat(client.currentHeight(TestCatalog.SOLANA)).isEqualTo(250_000_040L);
    }

    @Test
    void currentHeight_nonNumeric_throws() {
        mockRpc.response = "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"soon\"}";
        assertThatThrownBy(() -> client.currentHeight(TestCatalog.SOLANA)).isInstanceOf(RpcException.class);
    }

    static class MockSolanaRpcClient implements SolanaRpcClient {
        String response;
        final List<String> methods = new ArrayList<>();

        @Override
        public Mono<String> call(String endpointUrl, String method, Object params) {
            methods.add(method);
            return Mono.justOrEmpty(response);
        }
    }
}
