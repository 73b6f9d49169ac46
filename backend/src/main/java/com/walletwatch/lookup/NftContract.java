package com.walletwatch.lookup;

public record NftContract(String contractAddress, String name, String symbol) {
}
