package com.walletwatch.lookup;

public record TokenHolding(String name, String symbol, String balance) {
}
