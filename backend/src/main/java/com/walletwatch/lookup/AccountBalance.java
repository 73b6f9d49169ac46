package com.walletwatch.lookup;

import java.math.BigDecimal;

/**
 * Native KAIA balance. {@code usdPrice} and {@code valueUsd} are null when the price endpoint failed.
 */
public record AccountBalance(String address, BigDecimal balance, BigDecimal usdPrice, BigDecimal valueUsd) {
}
