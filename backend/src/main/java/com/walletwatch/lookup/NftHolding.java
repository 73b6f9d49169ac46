package com.walletwatch.lookup;

/**
 * @param tokenId set for KIP-37 (multi-token) holdings only
 */
public record NftHolding(String contractAddress, String name, String symbol, long tokenCount, String tokenId) {
}
