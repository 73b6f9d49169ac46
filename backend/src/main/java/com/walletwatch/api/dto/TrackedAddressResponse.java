package com.walletwatch.api.dto;

public record TrackedAddressResponse(String address, String label) {
}
