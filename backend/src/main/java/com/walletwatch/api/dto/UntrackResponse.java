package com.walletwatch.api.dto;

public record UntrackResponse(String identifier, boolean removed) {
}
