package com.workflow.admission.ratelimit.core;

import reactor.core.publisher.Mono;

/**
 * Explicit result of an engine call: either a decided value or the failure that prevented a
 * decision. Callers choose what to do with a failure instead of relying on error signals.
 */
public sealed interface Outcome<T> permits Outcome.Decided, Outcome.Failed {

    record Decided<T>(T value) implements Outcome<T> {}

    record Failed<T>(Throwable cause) implements Outcome<T> {}

    static <T> Mono<Outcome<T>> of(Mono<T> source) {
        return source
                .<Outcome<T>>map(Decided::new)
                .onErrorResume(e -> Mono.just(new Failed<>(e)));
    }
}
