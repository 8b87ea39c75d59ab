package com.stealthradar.monitor.adapter;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin RPC endpoint selection for one chain, so consecutive calls (and retries) spread over its endpoints.
 */
public class RpcEndpointRotator {

    private final String chain;
    private final List<String> endpoints;
    private final AtomicInteger index = new AtomicInteger(0);

    public RpcEndpointRotator(String chain, List<String> endpoints) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required for chain " + chain);
        }
        this.chain = chain;
        this.endpoints = List.copyOf(endpoints);
    }

    /**
     * Next endpoint in round-robin order.
     */
    public String getNextEndpoint() {
        int i = Math.floorMod(index.getAndIncrement(), endpoints.size());
        return endpoints.get(i);
    }

    public String getChain() {
        return chain;
    }

    public List<String> getEndpoints() {
        return endpoints;
    }
}
