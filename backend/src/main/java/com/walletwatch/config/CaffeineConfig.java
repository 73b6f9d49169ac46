package com.walletwatch.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches for account lookups. Tracking state is never cached.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String ACCOUNT_BALANCE_CACHE = "accountBalanceCache";
    public static final String TOKEN_HOLDINGS_CACHE = "tokenHoldingsCache";
    public static final String NFT_HOLDINGS_CACHE = "nftHoldingsCache";
    public static final String NFT_CONTRACT_CACHE = "nftContractCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(ACCOUNT_BALANCE_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(30, TimeUnit.SECONDS)
                .maximumSize(1_000)
                .build());
        manager.registerCustomCache(TOKEN_HOLDINGS_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(60, TimeUnit.SECONDS)
                .maximumSize(1_000)
                .build());
        manager.registerCustomCache(NFT_HOLDINGS_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(60, TimeUnit.SECONDS)
                .maximumSize(1_000)
                .build());
        manager.registerCustomCache(NFT_CONTRACT_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(24, TimeUnit.HOURS)
                .maximumSize(5_000)
                .build());
        return manager;
    }
}
