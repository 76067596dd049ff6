package com.workflow.admission.ratelimit.resilience;

import com.workflow.admission.ratelimit.core.AccessList;
import com.workflow.admission.ratelimit.core.StoreUnavailableException;
import com.workflow.admission.ratelimit.core.WindowHits;
import com.workflow.admission.ratelimit.core.WindowStore;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.timelimiter.TimeLimiterOperator;
import io.github.resilience4j.timelimiter.TimeLimiter;
import reactor.core.publisher.Mono;

/**
 * Bounds every store call with a time limiter and a circuit breaker. Any failure, including a
 * timeout or an open circuit, is reported as {@link StoreUnavailableException}.
 */
public class ResilientWindowStore implements WindowStore {

    private final WindowStore delegate;
    private final CircuitBreaker cb;
    private final TimeLimiter tl;

    public ResilientWindowStore(WindowStore delegate, CircuitBreaker cb, TimeLimiter tl) {
        this.delegate = delegate;
        this.cb = cb;
        this.tl = tl;
    }

    @Override
    public Mono<Long> getHits(String key, long windowStartMs) {
        return protect("getHits", delegate.getHits(key, windowStartMs));
    }

    @Override
    public Mono<WindowHits> incrementHits(String key, long nowMs, long windowMs, long points, long capacity) {
        return protect("incrementHits", delegate.incrementHits(key, nowMs, windowMs, points, capacity));
    }

    @Override
    public Mono<WindowHits> refundHits(String key, long nowMs, long windowStartMs, long points) {
        return protect("refundHits", delegate.refundHits(key, nowMs, windowStartMs, points));
    }

    @Override
    public Mono<Long> blockedUntil(String key) {
        return protect("blockedUntil", delegate.blockedUntil(key));
    }

    @Override
    public Mono<Void> block(String key, long nowMs, long untilMs) {
        return protect("block", delegate.block(key, nowMs, untilMs));
    }

    @Override
    public Mono<Void> resetKey(String key) {
        return protect("resetKey", delegate.resetKey(key));
    }

    @Override
    public Mono<Long> deleteOldHits(long cutoffMs) {
        return protect("deleteOldHits", delegate.deleteOldHits(cutoffMs));
    }

    @Override
    public Mono<Void> addToList(AccessList list, String identifier, long nowMs, long untilMs) {
        return protect("addToList", delegate.addToList(list, identifier, nowMs, untilMs));
    }

    @Override
    public Mono<Void> removeFromList(AccessList list, String identifier) {
        return protect("removeFromList", delegate.removeFromList(list, identifier));
    }

    @Override
    public Mono<Long> listedUntil(AccessList list, String identifier) {
        return protect("listedUntil", delegate.listedUntil(list, identifier));
    }

    private <T> Mono<T> protect(String op, Mono<T> call) {
        return call
                .transformDeferred(TimeLimiterOperator.of(tl))
                .transformDeferred(CircuitBreakerOperator.of(cb))
                .onErrorMap(e -> !(e instanceof StoreUnavailableException),
                        e -> new StoreUnavailableException("window store " + op + " failed: " + e, e));
    }
}
