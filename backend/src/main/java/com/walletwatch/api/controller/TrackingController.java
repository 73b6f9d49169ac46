package com.walletwatch.api.controller;

import com.walletwatch.api.dto.TrackRequest;
import com.walletwatch.api.dto.TrackResponse;
import com.walletwatch.api.dto.TrackedAddressResponse;
import com.walletwatch.api.dto.UntrackResponse;
import com.walletwatch.tracking.command.TrackingCommandService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

import static com.walletwatch.api.controller.BlockingCalls.offEventLoop;

/**
 * Track / list / untrack for one subscriber.
 */
@RestController
@RequestMapping("/api/v1/subscribers/{subscriberId}/tracked-addresses")
@RequiredArgsConstructor
public class TrackingController {

    private final TrackingCommandService trackingCommandService;

    @PostMapping
    public Mono<ResponseEntity<TrackResponse>> track(@PathVariable String subscriberId,
                                                     @Valid @RequestBody TrackRequest request) {
        return offEventLoop(() -> trackingCommandService.track(subscriberId, request.address(), request.label()))
                .map(confirmation -> ResponseEntity.status(HttpStatus.CREATED).body(new TrackResponse(
                        confirmation.subscriberId(),
                        confirmation.address(),
                        confirmation.label(),
                        "Tracking started")));
    }

    @GetMapping
    public Mono<List<TrackedAddressResponse>> list(@PathVariable String subscriberId) {
        return offEventLoop(() -> trackingCommandService.list(subscriberId).stream()
                .map(t -> new TrackedAddressResponse(t.getAddress(), t.getLabel()))
                .toList());
    }

    @DeleteMapping("/{identifier}")
    public Mono<ResponseEntity<UntrackResponse>> untrack(@PathVariable String subscriberId,
                                                         @PathVariable String identifier) {
        return offEventLoop(() -> trackingCommandService.untrack(subscriberId, identifier))
                .map(removed -> {
                    UntrackResponse body = new UntrackResponse(identifier, removed);
                    return removed ? ResponseEntity.ok(body) : ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
                });
    }
}
