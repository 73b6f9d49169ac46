package com.walletwatch.api.controller;

import com.walletwatch.common.AddressValidator;
import com.walletwatch.feed.FeedUnavailableException;
import com.walletwatch.lookup.AccountBalance;
import com.walletwatch.lookup.AccountLookupService;
import com.walletwatch.lookup.NftHolding;
import com.walletwatch.lookup.NftHoldings;
import com.walletwatch.lookup.TokenHolding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = AccountController.class)
@Import(AddressValidator.class)
class AccountControllerTest {

    private static final String MIXED = "0xAAAAaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";
    private static final String LOWER = "0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    AccountLookupService accountLookupService;

    @Test
    @DisplayName("GET balance lowercases the address and returns balance with USD value")
    void balance() {
        when(accountLookupService.balance(LOWER)).thenReturn(
                new AccountBalance(LOWER, new BigDecimal("12.5"), new BigDecimal("0.1234"), new BigDecimal("1.54")));

        webTestClient.get().uri("/api/v1/accounts/{address}/balance", MIXED)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.address").isEqualTo(LOWER)
                .jsonPath("$.balance").exists()
                .jsonPath("$.valueUsd").exists();

        verify(accountLookupService).balance(LOWER);
    }

    @Test
    @DisplayName("GET tokens returns holdings list")
    void tokens() {
        when(accountLookupService.tokens(LOWER)).thenReturn(List.of(new TokenHolding("Tether USD", "USDT", "100.5")));

        webTestClient.get().uri("/api/v1/accounts/{address}/tokens", LOWER)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].symbol").isEqualTo("USDT")
                .jsonPath("$[0].balance").isEqualTo("100.5");
    }

    @Test
    @DisplayName("GET nfts returns both standards")
    void nfts() {
        when(accountLookupService.nfts(LOWER)).thenReturn(new NftHoldings(LOWER,
                List.of(new NftHolding("0x1111111111111111111111111111111111111111", "Alpha", "ALP", 2L, null)),
                List.of()));

        webTestClient.get().uri("/api/v1/accounts/{address}/nfts", LOWER)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.kip17[0].name").isEqualTo("Alpha")
                .jsonPath("$.kip37").isEmpty();
    }

    @Test
    @DisplayName("invalid address returns 400 INVALID_ADDRESS without a lookup")
    void invalidAddress() {
        webTestClient.get().uri("/api/v1/accounts/{address}/balance", "0x123")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_ADDRESS");

        verifyNoInteractions(accountLookupService);
    }

    @Test
    @DisplayName("feed failure returns 502 FEED_UNAVAILABLE")
    void feedFailure() {
        when(accountLookupService.tokens(anyString())).thenThrow(new FeedUnavailableException("HTTP 503"));

        webTestClient.get().uri("/api/v1/accounts/{address}/tokens", LOWER)
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.error").isEqualTo("FEED_UNAVAILABLE");
    }
}
