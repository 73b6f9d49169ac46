package com.walletwatch.lookup;

import com.fasterxml.jackson.databind.JsonNode;
import com.walletwatch.common.RetryPolicy;
import com.walletwatch.config.CaffeineConfig;
import com.walletwatch.feed.FeedException;
import com.walletwatch.feed.FeedMalformedException;
import com.walletwatch.feed.FeedUnavailableException;
import com.walletwatch.feed.KaiascanApiClient;
import com.walletwatch.feed.config.FeedClientConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * One-shot account lookups: native balance with USD value, fungible token holdings, KIP-17/KIP-37 NFT holdings.
 * Callers pass a validated, lowercase address. Feed failures propagate as {@link FeedException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountLookupService {

    static final String ACCOUNT_PATH = "/accounts/{address}";
    static final String KAIA_PRICE_PATH = "/kaia";
    static final String TOKEN_DETAILS_PATH = "/accounts/{address}/token-details?size=2000";
    static final String NFT_BALANCES_PATH = "/accounts/{address}/nft-balances/{standard}";

    private static final int USD_SCALE = 2;

    private final KaiascanApiClient apiClient;
    private final NftContractResolver nftContractResolver;
    @Qualifier(FeedClientConfig.FEED_RETRY_POLICY)
    private final RetryPolicy feedRetryPolicy;

    @Cacheable(cacheNames = CaffeineConfig.ACCOUNT_BALANCE_CACHE, key = "#address")
    public AccountBalance balance(String address) {
        JsonNode account = withRetry(() -> apiClient.getJson(ACCOUNT_PATH, address));
        BigDecimal balance = decimal(account.get("balance"), "balance");
        Optional<BigDecimal> usdPrice = kaiaUsdPrice();
        return new AccountBalance(
                address,
                balance,
                usdPrice.orElse(null),
                usdPrice.map(p -> balance.multiply(p).setScale(USD_SCALE, RoundingMode.HALF_UP)).orElse(null));
    }

    @Cacheable(cacheNames = CaffeineConfig.TOKEN_HOLDINGS_CACHE, key = "#address")
    public List<TokenHolding> tokens(String address) {
        JsonNode root = withRetry(() -> apiClient.getJson(TOKEN_DETAILS_PATH, address));
        List<TokenHolding> holdings = new ArrayList<>();
        for (JsonNode token : results(root)) {
            JsonNode contract = token.path("contract");
            holdings.add(new TokenHolding(
                    contract.path("name").asText(null),
                    contract.path("symbol").asText(null),
                    token.path("balance").asText(null)));
        }
        return holdings;
    }

    @Cacheable(cacheNames = CaffeineConfig.NFT_HOLDINGS_CACHE, key = "#address")
    public NftHoldings nfts(String address) {
        JsonNode kip17 = withRetry(() -> apiClient.getJson(NFT_BALANCES_PATH, address, "kip17"));
        JsonNode kip37 = withRetry(() -> apiClient.getJson(NFT_BALANCES_PATH, address, "kip37"));
        return new NftHoldings(address, nftGroup(kip17, false), nftGroup(kip37, true));
    }

    private List<NftHolding> nftGroup(JsonNode root, boolean withTokenId) {
        List<NftHolding> group = new ArrayList<>();
        for (JsonNode entry : results(root)) {
            String contractAddress = entry.path("contract").path("contract_address").asText(null);
            if (contractAddress == null) {
                continue;
            }
            NftContract contract = nftContractResolver.resolve(contractAddress);
            if (contract == null) {
                continue;
            }
            group.add(new NftHolding(
                    contract.contractAddress(),
                    contract.name(),
                    contract.symbol(),
                    entry.path("token_count").asLong(0L),
                    withTokenId ? entry.path("token_id").asText(null) : null));
        }
        group.sort(Comparator.comparingLong(NftHolding::tokenCount).reversed());
        return group;
    }

    private Optional<BigDecimal> kaiaUsdPrice() {
        try {
            JsonNode root = apiClient.getJson(KAIA_PRICE_PATH);
            return Optional.of(decimal(root.path("klay_price").get("usd_price"), "klay_price.usd_price"));
        } catch (FeedException e) {
            log.warn("KAIA price unavailable: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private JsonNode withRetry(Supplier<JsonNode> call) {
        return feedRetryPolicy.execute(call, FeedUnavailableException.class::isInstance);
    }

    private static JsonNode results(JsonNode root) {
        JsonNode results = root.get("results");
        if (results == null || !results.isArray()) {
            throw new FeedMalformedException("Response has no results array");
        }
        return results;
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            throw new FeedMalformedException("Missing " + field);
        }
        try {
            return node.isNumber() ? node.decimalValue() : new BigDecimal(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new FeedMalformedException("Non-numeric " + field + ": " + node.asText(), e);
        }
    }
}
