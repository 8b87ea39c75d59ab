package com.stealthradar.monitor.adapter;

import java.util.List;

/**
 * Read-only access to one or more chains, addressed by configured chain name.
 */
public interface ChainClient {

    /**
     * Current head block of the chain.
     *
     * @throws RpcException on HTTP or JSON-RPC failure
     */
    long currentBlockHeight(String chain);

    /**
     * Logs emitted by {@code contractAddress} whose first topic is {@code eventTopic}, in [fromBlock, toBlock].
     *
     * @throws RpcException on HTTP or JSON-RPC failure
     */
    List<RawLog> getLogs(String chain, String contractAddress, String eventTopic, long fromBlock, long toBlock);
}
