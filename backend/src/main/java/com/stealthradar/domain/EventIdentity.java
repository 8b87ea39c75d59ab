package com.stealthradar.domain;

import java.util.Locale;

/**
 * Identity of one on-chain log: (chainId, txHash, logIndex). Two log records with the same identity are the
 * same event regardless of content. Tx hash is normalized to lower case.
 */
public record EventIdentity(long chainId, String txHash, long logIndex) {

    public EventIdentity {
        if (txHash == null || txHash.isBlank()) {
            throw new IllegalArgumentException("txHash required");
        }
        txHash = txHash.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return chainId + "-" + txHash + "-" + logIndex;
    }
}
