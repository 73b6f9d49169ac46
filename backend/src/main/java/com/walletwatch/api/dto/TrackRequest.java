package com.walletwatch.api.dto;

import com.walletwatch.api.validation.WalletAddress;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * POST /api/v1/subscribers/{subscriberId}/tracked-addresses body. Blank label = the address itself. A label must
 * fit in one path segment, since untrack takes it as {@code /{identifier}}.
 */
public record TrackRequest(
        @NotBlank(message = "INVALID_ADDRESS")
        @WalletAddress
        String address,

        @Size(max = 64, message = "INVALID_LABEL")
        @Pattern(regexp = "[^/]*", message = "INVALID_LABEL")
        String label
) {
}
