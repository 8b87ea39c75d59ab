package com.stealthradar.monitor.fetch;

import lombok.Getter;

/**
 * eth_getLogs for one (chain, contract, range) failed on every attempt. Signals a chain-level failure.
 */
@Getter
public class FetchException extends RuntimeException {

    private final String chain;
    private final long fromBlock;
    private final long toBlock;
    private final int attempts;

    public FetchException(String chain, String contractAddress, long fromBlock, long toBlock, int attempts, Throwable cause) {
        super("getLogs failed after " + attempts + " attempts on " + chain + " for " + contractAddress
                + " [" + fromBlock + "-" + toBlock + "]"
                + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        this.chain = chain;
        this.fromBlock = fromBlock;
        this.toBlock = toBlock;
        this.attempts = attempts;
    }
}
