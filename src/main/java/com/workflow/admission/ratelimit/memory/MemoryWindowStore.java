package com.workflow.admission.ratelimit.memory;

import com.workflow.admission.ratelimit.core.AccessList;
import com.workflow.admission.ratelimit.core.WindowHits;
import com.workflow.admission.ratelimit.core.WindowStore;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.TimeMeter;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One bucket4j bucket per key, refilled to capacity once per window. The window opens with the
 * first hit; once it ends the bucket is replaced on the next hit. Block deadlines and list entries
 * live in side maps. Per-key atomicity comes from {@link ConcurrentHashMap#compute}. Everything is
 * local to this JVM, so it is only correct for a single instance.
 *
 * <p>Buckets read time from the same {@link Clock} the engine uses, so their refill lines up with
 * the window ends the engine computes.
 */
public class MemoryWindowStore implements WindowStore {

    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final Map<String, Long> blocks = new ConcurrentHashMap<>();
    private final Map<AccessList, Map<String, Long>> lists = new EnumMap<>(AccessList.class);
    private final TimeMeter timeMeter;

    public MemoryWindowStore(Clock clock) {
        this.timeMeter = new ClockTimeMeter(clock);
        for (AccessList l : AccessList.values()) {
            lists.put(l, new ConcurrentHashMap<>());
        }
    }

    @Override
    public Mono<Long> getHits(String key, long windowStartMs) {
        return Mono.fromSupplier(() -> {
            Window w = windows.get(key);
            return w != null && w.startMs() > windowStartMs ? w.hits() : 0L;
        });
    }

    @Override
    public Mono<WindowHits> incrementHits(String key, long nowMs, long windowMs, long points, long capacity) {
        return Mono.fromSupplier(() -> {
            AtomicReference<WindowHits> result = new AtomicReference<>();
            windows.compute(key, (k, current) -> {
                boolean reusable = current != null && current.isLive(nowMs) && current.capacity() == capacity;
                Window w = reusable ? current : openWindow(nowMs, windowMs, capacity);
                if (points > capacity) {
                    result.set(w.hits(false));
                    return reusable ? current : null;
                }
                ConsumptionProbe probe = w.bucket().tryConsumeAndReturnRemaining(points);
                if (!probe.isConsumed()) {
                    result.set(w.hits(false));
                    return reusable ? current : null;
                }
                result.set(new WindowHits(true, capacity - probe.getRemainingTokens(), w.startMs(), w.endMs()));
                return w;
            });
            return result.get();
        });
    }

    @Override
    public Mono<WindowHits> refundHits(String key, long nowMs, long windowStartMs, long points) {
        return Mono.fromSupplier(() -> {
            AtomicReference<WindowHits> result = new AtomicReference<>(new WindowHits(false, 0, windowStartMs, nowMs));
            windows.computeIfPresent(key, (k, w) -> {
                if (!w.isLive(nowMs)) {
                    return w;
                }
                if (windowStartMs != ANY_WINDOW && windowStartMs != w.startMs()) {
                    result.set(w.hits(false));
                    return w;
                }
                w.bucket().addTokens(points);
                result.set(w.hits(true));
                return w;
            });
            return result.get();
        });
    }

    @Override
    public Mono<Long> blockedUntil(String key) {
        return Mono.fromSupplier(() -> blocks.getOrDefault(key, 0L));
    }

    @Override
    public Mono<Void> block(String key, long nowMs, long untilMs) {
        return Mono.fromRunnable(() -> {
            windows.remove(key);
            blocks.put(key, untilMs);
        });
    }

    @Override
    public Mono<Void> resetKey(String key) {
        return Mono.fromRunnable(() -> {
            windows.remove(key);
            blocks.remove(key);
        });
    }

    @Override
    public Mono<Long> deleteOldHits(long cutoffMs) {
        return Mono.fromSupplier(() -> {
            AtomicLong removed = new AtomicLong();
            windows.values().removeIf(w -> count(removed, w.endMs() <= cutoffMs));
            blocks.values().removeIf(until -> count(removed, until <= cutoffMs));
            lists.values().forEach(entries -> entries.values().removeIf(until -> count(removed, until <= cutoffMs)));
            return removed.get();
        });
    }

    @Override
    public Mono<Void> addToList(AccessList list, String identifier, long nowMs, long untilMs) {
        return Mono.fromRunnable(() -> lists.get(list).put(identifier, untilMs));
    }

    @Override
    public Mono<Void> removeFromList(AccessList list, String identifier) {
        return Mono.fromRunnable(() -> lists.get(list).remove(identifier));
    }

    @Override
    public Mono<Long> listedUntil(AccessList list, String identifier) {
        return Mono.fromSupplier(() -> lists.get(list).getOrDefault(identifier, 0L));
    }

    int size() {
        return windows.size() + blocks.size();
    }

    private Window openWindow(long nowMs, long windowMs, long capacity) {
        Bandwidth bandwidth = Bandwidth.builder()
                .capacity(capacity)
                .refillIntervally(capacity, Duration.ofMillis(windowMs))
                .build();
        Bucket bucket = Bucket.builder()
                .addLimit(bandwidth)
                .withCustomTimePrecision(timeMeter)
                .build();
        return new Window(bucket, capacity, nowMs, nowMs + windowMs);
    }

    private static boolean count(AtomicLong removed, boolean expired) {
        if (expired) removed.incrementAndGet();
        return expired;
    }

    record Window(Bucket bucket, long capacity, long startMs, long endMs) {

        boolean isLive(long nowMs) {
            return nowMs < endMs;
        }

        long hits() {
            return Math.max(0, capacity - bucket.getAvailableTokens());
        }

        WindowHits hits(boolean accepted) {
            return new WindowHits(accepted, hits(), startMs, endMs);
        }
    }

    private static final class ClockTimeMeter implements TimeMeter {

        private final Clock clock;

        ClockTimeMeter(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long currentTimeNanos() {
            return clock.millis() * 1_000_000L;
        }

        @Override
        public boolean isWallClockBased() {
            return true;
        }
    }
}
