package com.stealthradar.monitor.adapter;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC transport. Endpoint selection and throttling live in {@link EvmChainClient}.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_getLogs"
     * @param params      method params (e.g. filter object)
     * @return response body as string (JSON); errors with {@link RpcException} on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
