package com.workflow.admission.ratelimit.memory;

import com.workflow.admission.ratelimit.core.AccessList;
import com.workflow.admission.ratelimit.core.WindowHits;
import com.workflow.admission.ratelimit.core.WindowStore;
import com.workflow.admission.support.MutableClock;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class MemoryWindowStoreTest {

    private final MutableClock clock = MutableClock.startingAt(1_000);
    private final MemoryWindowStore store = new MemoryWindowStore(clock);

    @Test
    void first_hit_opens_window() {
        StepVerifier.create(store.incrementHits("k", 1_000, 60_000, 1, 5))
                .expectNext(new WindowHits(true, 1, 1_000, 61_000))
                .verifyComplete();
    }

    @Test
    void hit_over_capacity_is_rejected_and_not_counted() {
        store.incrementHits("k", 1_000, 60_000, 2, 2).block();

        WindowHits over = store.incrementHits("k", 2_000, 60_000, 1, 2).block();

        assertThat(over.accepted()).isFalse();
        assertThat(over.hits()).isEqualTo(2);
        assertThat(store.getHits("k", 0).block()).isEqualTo(2);
    }

    @Test
    void rejected_first_hit_leaves_no_entry() {
        WindowHits r = store.incrementHits("k", 1_000, 60_000, 3, 2).block();

        assertThat(r.accepted()).isFalse();
        assertThat(store.size()).isZero();
    }

    @Test
    void expired_window_starts_over_with_full_capacity() {
        store.incrementHits("k", 1_000, 10_000, 2, 2).block();
        clock.advance(Duration.ofMillis(10_000));

        WindowHits r = store.incrementHits("k", 11_000, 10_000, 2, 2).block();

        assertThat(r).isEqualTo(new WindowHits(true, 2, 11_000, 21_000));
    }

    @Test
    void get_hits_ignores_windows_started_before_the_cutoff() {
        store.incrementHits("k", 1_000, 60_000, 1, 5).block();

        assertThat(store.getHits("k", 0).block()).isEqualTo(1);
        assertThat(store.getHits("k", 1_000).block()).isZero();
        assertThat(store.getHits("missing", 0).block()).isZero();
    }

    @Test
    void refund_never_goes_below_zero() {
        store.incrementHits("k", 1_000, 60_000, 1, 5).block();

        WindowHits r = store.refundHits("k", 1_000, WindowStore.ANY_WINDOW, 3).block();

        assertThat(r.accepted()).isTrue();
        assertThat(r.hits()).isZero();
    }

    @Test
    void refund_for_a_window_that_rolled_over_changes_nothing() {
        store.incrementHits("k", 1_000, 10_000, 1, 2).block();
        clock.advance(Duration.ofMillis(11_000));
        store.incrementHits("k", 12_000, 10_000, 2, 2).block();

        WindowHits r = store.refundHits("k", 12_000, 1_000, 1).block();

        assertThat(r.accepted()).isFalse();
        assertThat(r.windowStartMs()).isEqualTo(12_000);
        assertThat(store.getHits("k", 0).block()).isEqualTo(2);
    }

    @Test
    void refund_of_the_live_window_gives_capacity_back() {
        store.incrementHits("k", 1_000, 10_000, 2, 2).block();

        assertThat(store.refundHits("k", 2_000, 1_000, 1).block().hits()).isEqualTo(1);
        assertThat(store.incrementHits("k", 2_000, 10_000, 1, 2).block().accepted()).isTrue();
    }

    @Test
    void block_drops_the_counter() {
        store.incrementHits("k", 1_000, 60_000, 2, 2).block();

        store.block("k", 1_000, 30_000).block();

        assertThat(store.blockedUntil("k").block()).isEqualTo(30_000);
        assertThat(store.getHits("k", 0).block()).isZero();
        assertThat(store.incrementHits("k", 31_000, 60_000, 2, 2).block().accepted()).isTrue();
    }

    @Test
    void reset_removes_counter_and_block() {
        store.incrementHits("k", 1_000, 60_000, 1, 5).block();
        store.block("k", 1_000, 90_000).block();

        store.resetKey("k").block();

        assertThat(store.blockedUntil("k").block()).isZero();
        assertThat(store.size()).isZero();
    }

    @Test
    void delete_old_hits_counts_removed_entries() {
        store.incrementHits("a", 0, 10_000, 1, 5).block();
        store.block("b", 0, 50_000).block();
        store.incrementHits("c", 5_000, 10_000, 1, 5).block();
        store.addToList(AccessList.BLACKLIST, "x", 0, 20_000).block();
        store.addToList(AccessList.WHITELIST, "y", 0, WindowStore.NO_EXPIRY).block();

        assertThat(store.deleteOldHits(10_000).block()).isEqualTo(1L);
        assertThat(store.size()).isEqualTo(2);
        assertThat(store.deleteOldHits(50_000).block()).isEqualTo(3L);
        assertThat(store.listedUntil(AccessList.WHITELIST, "y").block()).isEqualTo(WindowStore.NO_EXPIRY);
    }

    @Test
    void list_entries_are_kept_per_list() {
        store.addToList(AccessList.BLACKLIST, "1.2.3.4", 0, 60_000).block();

        assertThat(store.listedUntil(AccessList.BLACKLIST, "1.2.3.4").block()).isEqualTo(60_000);
        assertThat(store.listedUntil(AccessList.WHITELIST, "1.2.3.4").block()).isZero();

        store.removeFromList(AccessList.BLACKLIST, "1.2.3.4").block();

        assertThat(store.listedUntil(AccessList.BLACKLIST, "1.2.3.4").block()).isZero();
    }

    @Test
    void concurrent_hits_never_exceed_capacity() throws Exception {
        int threads = 16;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        try {
            for (int t = 0; t < threads; t++) {
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        if (store.incrementHits("hot", 1_000, 60_000, 1, 100).block().accepted()) {
                            accepted.incrementAndGet();
                        }
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(accepted.get()).isEqualTo(100);
        assertThat(store.getHits("hot", 0).block()).isEqualTo(100);
    }
}
