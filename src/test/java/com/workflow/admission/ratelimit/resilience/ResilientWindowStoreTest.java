package com.workflow.admission.ratelimit.resilience;

import com.workflow.admission.ratelimit.core.AccessList;
import com.workflow.admission.ratelimit.core.StoreUnavailableException;
import com.workflow.admission.ratelimit.core.WindowHits;
import com.workflow.admission.ratelimit.core.WindowStore;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ResilientWindowStoreTest {

    private WindowStore delegate;
    private CircuitBreaker cb;
    private ResilientWindowStore store;

    @BeforeEach
    void setUp() {
        delegate = mock(WindowStore.class);
        cb = CircuitBreaker.of("windowStore", CircuitBreakerConfig.ofDefaults());
        TimeLimiter tl = TimeLimiter.of(TimeLimiterConfig.custom().timeoutDuration(Duration.ofMillis(50)).build());
        store = new ResilientWindowStore(delegate, cb, tl);
    }

    @Test
    void passes_through_successful_calls() {
        when(delegate.incrementHits("k", 0, 1_000, 1, 5)).thenReturn(Mono.just(new WindowHits(true, 1, 0, 1_000)));

        StepVerifier.create(store.incrementHits("k", 0, 1_000, 1, 5))
                .expectNext(new WindowHits(true, 1, 0, 1_000))
                .verifyComplete();
    }

    @Test
    void list_lookups_are_protected_too() {
        when(delegate.listedUntil(AccessList.BLACKLIST, "k")).thenReturn(Mono.error(new IllegalStateException("connection reset")));

        StepVerifier.create(store.listedUntil(AccessList.BLACKLIST, "k"))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(StoreUnavailableException.class)
                        .hasMessageContaining("listedUntil"))
                .verify();
    }

    @Test
    void refunds_pass_the_target_window_through() {
        when(delegate.refundHits("k", 5_000, 1_000, 1)).thenReturn(Mono.just(new WindowHits(false, 2, 4_000, 9_000)));

        StepVerifier.create(store.refundHits("k", 5_000, 1_000, 1))
                .expectNext(new WindowHits(false, 2, 4_000, 9_000))
                .verifyComplete();
    }

    @Test
    void slow_store_times_out_as_unavailable() {
        when(delegate.blockedUntil(anyString())).thenReturn(Mono.never());

        StepVerifier.create(store.blockedUntil("k"))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(StoreUnavailableException.class)
                        .hasCauseInstanceOf(TimeoutException.class))
                .verify(Duration.ofSeconds(2));
    }

    @Test
    void store_errors_are_wrapped() {
        when(delegate.getHits(anyString(), anyLong())).thenReturn(Mono.error(new IllegalStateException("connection reset")));

        StepVerifier.create(store.getHits("k", 0))
                .expectError(StoreUnavailableException.class)
                .verify();
    }

    @Test
    void open_circuit_is_reported_as_unavailable() {
        cb.transitionToOpenState();
        when(delegate.blockedUntil(anyString())).thenReturn(Mono.just(0L));

        StepVerifier.create(store.blockedUntil("k"))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(StoreUnavailableException.class)
                        .hasCauseInstanceOf(CallNotPermittedException.class))
                .verify();
    }
}
