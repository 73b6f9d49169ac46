package com.walletwatch.lookup;

import com.fasterxml.jackson.databind.JsonNode;
import com.walletwatch.config.CaffeineConfig;
import com.walletwatch.feed.FeedException;
import com.walletwatch.feed.KaiascanApiClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * NFT contract name/symbol via {@code /nfts/{contract}}. Cached 24h; failures are not cached.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NftContractResolver {

    private final KaiascanApiClient apiClient;

    @Cacheable(cacheNames = CaffeineConfig.NFT_CONTRACT_CACHE, key = "#contractAddress.toLowerCase()", unless = "#result == null")
    public NftContract resolve(String contractAddress) {
        return fetch(contractAddress).orElse(null);
    }

    private Optional<NftContract> fetch(String contractAddress) {
        try {
            JsonNode root = apiClient.getJson("/nfts/{contract}", contractAddress);
            String name = root.path("name").asText(null);
            if (name == null) {
                return Optional.empty();
            }
            return Optional.of(new NftContract(contractAddress.toLowerCase(Locale.ROOT), name, root.path("symbol").asText(null)));
        } catch (FeedException e) {
            log.warn("NFT contract {} unavailable: {}", contractAddress, e.getMessage());
            return Optional.empty();
        }
    }
}
