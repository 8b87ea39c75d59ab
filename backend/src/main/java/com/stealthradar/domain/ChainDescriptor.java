package com.stealthradar.domain;

/**
 * Stable chain name (config key) with its numeric EVM chain id.
 */
public record ChainDescriptor(String name, long chainId) {
}
