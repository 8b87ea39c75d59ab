package com.stealthradar.monitor.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stealthradar.monitor.config.EvmRpcProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ChainClient} over EVM JSON-RPC: eth_blockNumber and eth_getLogs filtered by contract address and event topic.
 * One call per invocation (no retry here, see LogFetcher); endpoints rotate per call and rate-limited endpoints
 * are skipped for a cool-down period.
 */
@Slf4j
@Component
public class EvmChainClient implements ChainClient {

    private final Map<String, Long> endpointCooldownUntilMs = new ConcurrentHashMap<>();

    private final EvmRpcClient rpcClient;
    private final Map<String, RpcEndpointRotator> rotatorsByChain;
    private final RateLimiter evmRpcRateLimiter;
    private final EvmRpcProperties evmRpcProperties;
    private final ObjectMapper objectMapper;

    public EvmChainClient(
            EvmRpcClient rpcClient,
            @Qualifier("evmRotatorsByChain") Map<String, RpcEndpointRotator> rotatorsByChain,
            @Qualifier("evmRpcRateLimiter") RateLimiter evmRpcRateLimiter,
            EvmRpcProperties evmRpcProperties,
            ObjectMapper objectMapper
    ) {
        this.rpcClient = rpcClient;
        this.rotatorsByChain = rotatorsByChain;
        this.evmRpcRateLimiter = evmRpcRateLimiter;
        this.evmRpcProperties = evmRpcProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public long currentBlockHeight(String chain) {
        String endpoint = nextEndpoint(rotator(chain));
        JsonNode result = resultOf(endpoint, "eth_blockNumber", Collections.emptyList());
        String hex = result.asText(null);
        if (hex == null || !hex.startsWith("0x")) {
            throw new RpcException("eth_blockNumber invalid result on " + chain + ": " + hex);
        }
        return parseHexLong(hex, "eth_blockNumber");
    }

    @Override
    public List<RawLog> getLogs(String chain, String contractAddress, String eventTopic, long fromBlock, long toBlock) {
        if (fromBlock > toBlock) {
            return List.of();
        }
        String endpoint = nextEndpoint(rotator(chain));
        Map<String, Object> filter = new HashMap<>();
        filter.put("address", contractAddress);
        filter.put("topics", List.of(eventTopic));
        filter.put("fromBlock", "0x" + Long.toHexString(fromBlock));
        filter.put("toBlock", "0x" + Long.toHexString(toBlock));
        JsonNode result = resultOf(endpoint, "eth_getLogs", Collections.singletonList(filter));
        if (!result.isArray()) {
            throw new RpcException("eth_getLogs returned non-array result on " + chain + " for "
                    + fromBlock + "-" + toBlock + ": " + (result.isMissingNode() ? "<missing>" : result));
        }
        List<RawLog> logs = new ArrayList<>(result.size());
        for (JsonNode node : result) {
            logs.add(toRawLog(node));
        }
        return logs;
    }

    private JsonNode resultOf(String endpoint, String method, Object params) {
        String json;
        try {
            json = callRpc(endpoint, method, params);
        } catch (RpcException e) {
            if (isRateLimited(e)) {
                markEndpointCoolingDown(endpoint, e);
            }
            throw e;
        }
        if (json == null) {
            throw new RpcException(method + " returned empty body from " + endpoint);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + method + " response", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            RpcException rpcError = new RpcException(method + " error: " + error);
            if (isRateLimited(rpcError)) {
                markEndpointCoolingDown(endpoint, rpcError);
            }
            throw rpcError;
        }
        return root.path("result");
    }

    private RawLog toRawLog(JsonNode node) {
        List<String> topics = new ArrayList<>();
        node.path("topics").forEach(t -> topics.add(t.asText()));
        return new RawLog(
                node.path("address").asText(null),
                node.path("transactionHash").asText(null),
                parseHexLong(node.path("blockNumber").asText(null), "blockNumber"),
                parseHexLong(node.path("logIndex").asText(null), "logIndex"),
                topics,
                node.path("data").asText("0x")
        );
    }

    private String callRpc(String endpoint, String method, Object params) {
        long acquireStart = System.nanoTime();
        boolean permitted = evmRpcRateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new RpcException("Local limiter timeout before " + method + " on " + endpoint);
        }
        if (waitedMs >= Math.max(1L, evmRpcProperties.getLocalLimiterLogThresholdMs())) {
            log.info("Local EVM RPC limiter delayed {} ms before {} on {}", waitedMs, method, endpoint);
        }
        return rpcClient.call(endpoint, method, params).block();
    }

    private RpcEndpointRotator rotator(String chain) {
        RpcEndpointRotator rotator = rotatorsByChain.get(chain);
        if (rotator == null) {
            throw new RpcException("No RPC endpoints configured for chain " + chain);
        }
        return rotator;
    }

    private String nextEndpoint(RpcEndpointRotator rotator) {
        long nowMs = System.currentTimeMillis();
        int checked = Math.max(1, rotator.getEndpoints().size());
        for (int i = 0; i < checked; i++) {
            String endpoint = rotator.getNextEndpoint();
            Long cooldownUntil = endpointCooldownUntilMs.get(endpoint);
            if (cooldownUntil == null || cooldownUntil <= nowMs) {
                return endpoint;
            }
            log.debug("Skipping cooled-down endpoint {} for {} ms", endpoint, cooldownUntil - nowMs);
        }
        return rotator.getNextEndpoint();
    }

    private void markEndpointCoolingDown(String endpoint, Exception cause) {
        long cooldownMs = Math.max(1_000L, evmRpcProperties.getEndpointCooldownMs());
        long nowMs = System.currentTimeMillis();
        Long prevUntil = endpointCooldownUntilMs.put(endpoint, nowMs + cooldownMs);
        if (prevUntil == null || prevUntil <= nowMs) {
            log.warn("Endpoint {} cooled down for {} ms due to suspected RPC rate-limit: {}",
                    endpoint, cooldownMs, cause.getMessage());
        }
    }

    boolean isCoolingDown(String endpoint) {
        Long until = endpointCooldownUntilMs.get(endpoint);
        return until != null && until > System.currentTimeMillis();
    }

    static boolean isRateLimited(Exception e) {
        if (e == null || e.getMessage() == null) return false;
        String msg = e.getMessage().toLowerCase();
        return msg.contains("429") || msg.contains("too many requests")
                || msg.contains("rate limit") || msg.contains("limit exceeded")
                || msg.contains("request limit") || msg.contains("-32005");
    }

    private static long parseHexLong(String hex, String field) {
        if (hex == null || !hex.startsWith("0x") || hex.length() < 3) {
            throw new RpcException("Invalid hex " + field + ": " + hex);
        }
        try {
            return Long.parseLong(hex.substring(2), 16);
        } catch (NumberFormatException e) {
            throw new RpcException("Invalid hex " + field + ": " + hex, e);
        }
    }
}
