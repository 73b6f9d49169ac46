package com.walletwatch.api.controller;

import com.walletwatch.api.dto.ErrorBody;
import com.walletwatch.common.AddressValidator;
import com.walletwatch.lookup.AccountLookupService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Locale;
import java.util.function.Function;

import static com.walletwatch.api.controller.BlockingCalls.offEventLoop;

/**
 * GET /accounts/{address}/balance|tokens|nfts. Feed failures are mapped by {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/accounts/{address}")
@RequiredArgsConstructor
public class AccountController {

    private final AddressValidator addressValidator;
    private final AccountLookupService accountLookupService;

    @GetMapping("/balance")
    public Mono<ResponseEntity<?>> balance(@PathVariable String address) {
        return lookup(address, accountLookupService::balance);
    }

    @GetMapping("/tokens")
    public Mono<ResponseEntity<?>> tokens(@PathVariable String address) {
        return lookup(address, accountLookupService::tokens);
    }

    @GetMapping("/nfts")
    public Mono<ResponseEntity<?>> nfts(@PathVariable String address) {
        return lookup(address, accountLookupService::nfts);
    }

    private Mono<ResponseEntity<?>> lookup(String address, Function<String, ?> query) {
        if (!addressValidator.isValidAddress(address)) {
            return Mono.just(ResponseEntity.badRequest().body(ErrorBody.invalidAddress()));
        }
        String normalized = address.trim().toLowerCase(Locale.ROOT);
        return offEventLoop(() -> ResponseEntity.ok(query.apply(normalized)));
    }
}
