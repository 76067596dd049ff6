package com.workflow.admission.ratelimit.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Admission decisions over named limiters. Counters live in the {@link WindowStore} under
 * {@code "<limiter>:<key>"}; the engine itself keeps no per-request state and takes no locks.
 *
 * <p>A key that exceeds its capacity is blocked for the limiter's block duration. While the block
 * lasts every check is rejected; the counter is dropped when the block starts, so the key gets its
 * full capacity back once the block ends.
 *
 * <p>Before counting, the key is looked up in the {@link AccessList}s: whitelisted keys are admitted
 * without being counted and blacklisted keys are rejected, for every limiter.
 */
public class RateLimitEngine {

    private static final Logger log = LoggerFactory.getLogger(RateLimitEngine.class);

    private final LimiterRegistry registry;
    private final WindowStore store;
    private final Clock clock;

    public RateLimitEngine(LimiterRegistry registry, WindowStore store, Clock clock) {
        this.registry = registry;
        this.store = store;
        this.clock = clock;
    }

    public LimiterRegistry registry() {
        return registry;
    }

    public LimiterConfig createLimiter(String name, int points, long durationSeconds, long blockDurationSeconds) {
        return registry.create(name, points, durationSeconds, blockDurationSeconds);
    }

    public Mono<CheckResult> checkLimit(String limiterName, String key) {
        return checkLimit(limiterName, key, 1);
    }

    public Mono<CheckResult> checkLimit(String limiterName, String key, int points) {
        return Mono.defer(() -> {
            LimiterConfig cfg = registry.get(limiterName);
            if (points <= 0) {
                return Mono.error(new IllegalArgumentException("points must be > 0, was " + points));
            }
            String storeKey = storeKey(cfg.name(), key);
            long now = clock.millis();
            return store.listedUntil(AccessList.WHITELIST, key)
                    .flatMap(white -> {
                        if (white > now) return Mono.just(CheckResult.unmetered(cfg.points()));
                        return store.listedUntil(AccessList.BLACKLIST, key)
                                .flatMap(black -> black > now
                                        ? Mono.just(CheckResult.denied(black == WindowStore.NO_EXPIRY ? null : seconds(black - now)))
                                        : checkBlockThenConsume(cfg, storeKey, points, now));
                    });
        });
    }

    /** Same as {@link #checkLimit(String, String, int)} but never signals an error. */
    public Mono<Outcome<CheckResult>> tryCheckLimit(String limiterName, String key, int points) {
        return Outcome.of(checkLimit(limiterName, key, points));
    }

    /**
     * Checks {@code limits} in order and stops at the first one that rejects. Capacity consumed by
     * limits checked before a failing one is kept. Every limiter name is resolved before anything
     * is consumed, so a misconfigured list fails without side effects.
     */
    public Mono<MultiCheckResult> checkMultipleLimits(List<LimitRequest> limits, String key) {
        return Mono.defer(() -> {
            limits.forEach(l -> registry.get(l.limiterName()));
            return Flux.fromIterable(limits)
                    .concatMap(l -> checkLimit(l.limiterName(), key, l.points())
                            .map(r -> r.allowed()
                                    ? MultiCheckResult.passed()
                                    : MultiCheckResult.failed(l.limiterName(), r.retryAfterSeconds())))
                    .filter(r -> !r.allowed())
                    .next()
                    .defaultIfEmpty(MultiCheckResult.passed());
        });
    }

    public Mono<Outcome<MultiCheckResult>> tryCheckMultipleLimits(List<LimitRequest> limits, String key) {
        return Outcome.of(checkMultipleLimits(limits, key));
    }

    /** Clears counter and block state of {@code key}. Administrative override. */
    public Mono<Void> resetLimit(String limiterName, String key) {
        return Mono.defer(() -> {
            LimiterConfig cfg = registry.get(limiterName);
            log.info("resetting limiter {} for key {}", cfg.name(), key);
            return store.resetKey(storeKey(cfg.name(), key));
        });
    }

    /**
     * Gives back {@code points} to whatever window of {@code key} is live. Emits the remaining
     * capacity, which stays within {@code [0, points]} of the limiter.
     */
    public Mono<Long> refund(String limiterName, String key, int points) {
        return refund(limiterName, key, points, WindowStore.ANY_WINDOW);
    }

    /**
     * Gives back {@code points} to the window that started at {@code windowStartMs}, which is the
     * window that admitted the request. A refund arriving after that window rolled over changes
     * nothing.
     */
    public Mono<Long> refund(String limiterName, String key, int points, long windowStartMs) {
        return Mono.defer(() -> {
                    LimiterConfig cfg = registry.get(limiterName);
                    long now = clock.millis();
                    return store.refundHits(storeKey(cfg.name(), key), now, windowStartMs, points)
                            .map(hits -> Math.max(0, Math.min(cfg.points(), cfg.points() - hits.hits())));
                })
                .onErrorMap(e -> !(e instanceof ConfigurationException), e -> new RefundException(limiterName, e));
    }

    public Mono<Consumption> getCurrentConsumption(String limiterName, String key) {
        return Mono.defer(() -> {
            LimiterConfig cfg = registry.get(limiterName);
            String storeKey = storeKey(cfg.name(), key);
            long now = clock.millis();
            return Mono.zip(store.getHits(storeKey, now - cfg.window().toMillis()), store.blockedUntil(storeKey))
                    .map(t -> new Consumption(
                            t.getT1(),
                            Math.max(0, cfg.points() - t.getT1()),
                            t.getT2() > now ? t.getT2() : 0));
        });
    }

    public Mono<Long> sweepExpired() {
        return store.deleteOldHits(clock.millis());
    }

    /** Rejects {@code identifier} on every limiter for {@code ttl}, or until removed when ttl is null. */
    public Mono<Void> addToBlacklist(String identifier, Duration ttl) {
        return addToList(AccessList.BLACKLIST, identifier, ttl);
    }

    public Mono<Void> removeFromBlacklist(String identifier) {
        return removeFromList(AccessList.BLACKLIST, identifier);
    }

    public Mono<Void> addToWhitelist(String identifier) {
        return addToList(AccessList.WHITELIST, identifier, null);
    }

    public Mono<Void> removeFromWhitelist(String identifier) {
        return removeFromList(AccessList.WHITELIST, identifier);
    }

    public Mono<Void> addToList(AccessList list, String identifier, Duration ttl) {
        return Mono.defer(() -> {
            requireIdentifier(identifier);
            if (ttl != null && (ttl.isNegative() || ttl.isZero())) {
                return Mono.error(new IllegalArgumentException("ttl must be positive, was " + ttl));
            }
            long now = clock.millis();
            long until = ttl == null ? WindowStore.NO_EXPIRY : now + ttl.toMillis();
            log.info("adding {} to {} ({})", identifier, list.id(), ttl == null ? "no expiry" : "ttl " + ttl);
            return store.addToList(list, identifier, now, until);
        });
    }

    public Mono<Void> removeFromList(AccessList list, String identifier) {
        return Mono.defer(() -> {
            requireIdentifier(identifier);
            log.info("removing {} from {}", identifier, list.id());
            return store.removeFromList(list, identifier);
        });
    }

    /** Whether {@code identifier} is currently on {@code list}. */
    public Mono<Boolean> isListed(AccessList list, String identifier) {
        return Mono.defer(() -> {
            long now = clock.millis();
            return store.listedUntil(list, identifier).map(until -> until > now);
        });
    }

    private Mono<CheckResult> checkBlockThenConsume(LimiterConfig cfg, String storeKey, int points, long now) {
        return store.blockedUntil(storeKey)
                .flatMap(until -> until > now
                        ? Mono.just(CheckResult.blocked(seconds(until - now)))
                        : consume(cfg, storeKey, points, now));
    }

    static String storeKey(String limiterName, String key) {
        return limiterName + ":" + key;
    }

    private static void requireIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier must not be blank");
        }
    }

    private static long seconds(long millis) {
        return millis <= 0 ? 0 : (millis + 999) / 1000;
    }
}
