package com.walletwatch.api.dto;

public record TrackResponse(String subscriberId, String address, String label, String message) {
}
