package com.walletwatch.api.controller;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.Callable;

/**
 * Service calls behind the controllers block (WebClient {@code block()}, MongoTemplate, retry backoff), so they run on
 * the bounded-elastic scheduler and never on a Netty event-loop thread. Exceptions surface as error signals and are
 * mapped by {@link ApiExceptionHandler}.
 */
final class BlockingCalls {

    private BlockingCalls() {
    }

    static <T> Mono<T> offEventLoop(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
