package com.workflow.admission.ratelimit.core;

import reactor.core.publisher.Mono;

/**
 * Counter storage keyed by identity. Every mutation must be atomic per key: the engine takes
 * no locks of its own and relies on this guarantee for correctness under concurrent requests.
 */
public interface WindowStore {

    /** Refund target meaning "whatever window is live now". */
    long ANY_WINDOW = -1L;

    /** List entry deadline for entries that never expire. */
    long NO_EXPIRY = Long.MAX_VALUE;

    /** Hits recorded in a window that started after {@code windowStartMs}. */
    Mono<Long> getHits(String key, long windowStartMs);

    /**
     * Adds {@code points} to the live window of {@code key}, opening a new window of
     * {@code windowMs} when none is live. An increment that would take the count past
     * {@code capacity} is rejected without changing anything.
     */
    Mono<WindowHits> incrementHits(String key, long nowMs, long windowMs, long points, long capacity);

    /**
     * Gives {@code points} back to the window that started at {@code windowStartMs}, or to the
     * live window when it is {@link #ANY_WINDOW}. Nothing changes when that window is no longer
     * live. The count never goes below zero. The reply is not accepted when nothing was given back.
     */
    Mono<WindowHits> refundHits(String key, long nowMs, long windowStartMs, long points);

    /** Epoch millis until which the key is blocked, or 0. */
    Mono<Long> blockedUntil(String key);

    /** Blocks the key until {@code untilMs} and drops its counter, so the block ends with full capacity. */
    Mono<Void> block(String key, long nowMs, long untilMs);

    /** Clears the counter and any block state. */
    Mono<Void> resetKey(String key);

    /** Removes entries whose window and block both ended at or before {@code cutoffMs}. */
    Mono<Long> deleteOldHits(long cutoffMs);

    /** Lists {@code identifier} until {@code untilMs}, or for good when it is {@link #NO_EXPIRY}. */
    Mono<Void> addToList(AccessList list, String identifier, long nowMs, long untilMs);

    Mono<Void> removeFromList(AccessList list, String identifier);

    /** Deadline of the list entry, {@link #NO_EXPIRY} for a permanent one, 0 when not listed. */
    Mono<Long> listedUntil(AccessList list, String identifier);
}
