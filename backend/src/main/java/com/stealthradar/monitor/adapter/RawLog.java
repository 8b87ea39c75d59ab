package com.stealthradar.monitor.adapter;

import java.util.List;

/**
 * One log record as returned by eth_getLogs. Numeric fields already decoded from hex.
 */
public record RawLog(
        String address,
        String transactionHash,
        long blockNumber,
        long logIndex,
        List<String> topics,
        String data
) {

    public RawLog {
        topics = topics != null ? List.copyOf(topics) : List.of();
    }

    public String topic(int index) {
        return index < topics.size() ? topics.get(index) : null;
    }
}
