package com.stealthradar.monitor.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stealthradar.monitor.config.EvmRpcProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvmChainClientTest {

    private static final String TOPIC = "0x5f0eab8057630ba7676c49b4f21a0231414e79474595be8e4c432fbf6bf0f4e7";

    private MockEvmRpcClient mockRpc;
    private EvmChainClient client;

    @BeforeEach
    void setUp() {
        mockRpc = new MockEvmRpcClient();
        Map<String, RpcEndpointRotator> rotators = Map.of(
                "mainnet", new RpcEndpointRotator("mainnet", List.of("https://a.rpc", "https://b.rpc")),
                "base", new RpcEndpointRotator("base", List.of("https://base.rpc")));
        client = new EvmChainClient(mockRpc, rotators, fastLimiter(), evmRpcProps(), new ObjectMapper());
    }

    @Test
    void currentBlockHeight_parsesHexResult() {
        mockRpc.respond("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x41a\"}");

        assertThat(client.currentBlockHeight("base")).isEqualTo(1050L);
        assertThat(mockRpc.calls).extracting(Call::method).containsExactly("eth_blockNumber");
    }

    @Test
    void getLogs_buildsFilterAndParsesLogs() {
        mockRpc.respond("""
                {"jsonrpc":"2.0","id":1,"result":[
                  {"address":"0x55649e01b5df198d18d95b5cc5051630cfd45564","transactionHash":"0xAbC","blockNumber":"0x3e9",
                   "logIndex":"0x2","topics":["%s","0x01"],"data":"0x"}
                ]}
                """.formatted(TOPIC));

        List<RawLog> logs = client.getLogs("mainnet", "0x55649e01b5df198d18d95b5cc5051630cfd45564", TOPIC, 1001, 1050);

        assertThat(logs).hasSize(1);
        RawLog log = logs.get(0);
        assertThat(log.transactionHash()).isEqualTo("0xAbC");
        assertThat(log.blockNumber()).isEqualTo(1001L);
        assertThat(log.logIndex()).isEqualTo(2L);
        assertThat(log.topic(0)).isEqualTo(TOPIC);

        @SuppressWarnings("unchecked")
        Map<String, Object> filter = (Map<String, Object>) ((List<?>) mockRpc.calls.get(0).params()).get(0);
        assertThat(filter).containsEntry("fromBlock", "0x3e9")
                .containsEntry("toBlock", "0x41a")
                .containsEntry("address", "0x55649e01b5df198d18d95b5cc5051630cfd45564")
                .containsEntry("topics", List.of(TOPIC));
    }

    @Test
    void getLogs_emptyRange_noCall() {
        assertThat(client.getLogs("mainnet", "0xabc", TOPIC, 10, 9)).isEmpty();
        assertThat(mockRpc.calls).isEmpty();
    }

    @Test
    void rotatesEndpointsAcrossCalls() {
        mockRpc.respond("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x1\"}");

        client.currentBlockHeight("mainnet");
        client.currentBlockHeight("mainnet");

        assertThat(mockRpc.calls).extracting(Call::endpoint).containsExactly("https://a.rpc", "https://b.rpc");
    }

    @Test
    void jsonRpcError_throwsRpcException() {
        mockRpc.respond("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32000,\"message\":\"header not found\"}}");

        assertThatThrownBy(() -> client.getLogs("base", "0xabc", TOPIC, 1, 2))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("eth_getLogs error");
    }

    @Test
    void getLogs_nullResult_throwsRpcException() {
        mockRpc.respond("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}");

        assertThatThrownBy(() -> client.getLogs("base", "0xabc", TOPIC, 1001, 1050))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("non-array result");
    }

    @Test
    void getLogs_missingResult_throwsRpcException() {
        mockRpc.respond("{\"jsonrpc\":\"2.0\",\"id\":1}");

        assertThatThrownBy(() -> client.getLogs("base", "0xabc", TOPIC, 1001, 1050))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("<missing>");
    }

    @Test
    void rateLimitedEndpoint_cooledDownAndSkipped() {
        mockRpc.respondFor("https://a.rpc", Mono.error(new RpcException("429 Too Many Requests")));
        mockRpc.respond("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x10\"}");

        assertThatThrownBy(() -> client.currentBlockHeight("mainnet")).isInstanceOf(RpcException.class);
        assertThat(client.isCoolingDown("https://a.rpc")).isTrue();

        assertThat(client.currentBlockHeight("mainnet")).isEqualTo(16L);
        assertThat(client.currentBlockHeight("mainnet")).isEqualTo(16L);
        assertThat(mockRpc.calls).extracting(Call::endpoint)
                .containsExactly("https://a.rpc", "https://b.rpc", "https://b.rpc");
    }

    @Test
    void unknownChain_throwsRpcException() {
        assertThatThrownBy(() -> client.currentBlockHeight("polygon"))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("No RPC endpoints configured for chain polygon");
    }

    @Test
    void invalidHeadResult_throwsRpcException() {
        mockRpc.respond("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}");

        assertThatThrownBy(() -> client.currentBlockHeight("base")).isInstanceOf(RpcException.class);
    }

    @Test
    void isRateLimited_recognisesProviderMessages() {
        assertThat(EvmChainClient.isRateLimited(new RpcException("HTTP 429"))).isTrue();
        assertThat(EvmChainClient.isRateLimited(new RpcException("error -32005 limit exceeded"))).isTrue();
        assertThat(EvmChainClient.isRateLimited(new RpcException("execution reverted"))).isFalse();
        assertThat(EvmChainClient.isRateLimited(null)).isFalse();
    }

    private static RateLimiter fastLimiter() {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(1_000_000)
                .timeoutDuration(Duration.ofMillis(1))
                .build();
        return RateLimiter.of("test-evm-fast-limiter", config);
    }

    private static EvmRpcProperties evmRpcProps() {
        EvmRpcProperties props = new EvmRpcProperties();
        props.setMaxRequestsPerSecond(100_000);
        props.setEndpointCooldownMs(60_000);
        return props;
    }

    record Call(String endpoint, String method, Object params) {
    }

    private static class MockEvmRpcClient implements EvmRpcClient {
        private final List<Call> calls = new ArrayList<>();
        private final Map<String, Mono<String>> byEndpoint = new HashMap<>();
        private String response = "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":[]}";

        void respond(String response) {
            this.response = response;
        }

        void respondFor(String endpoint, Mono<String> response) {
            byEndpoint.put(endpoint, response);
        }

        @Override
        public Mono<String> call(String endpointUrl, String method, Object params) {
            calls.add(new Call(endpointUrl, method, params));
            return byEndpoint.getOrDefault(endpointUrl, Mono.just(response));
        }
    }
}
