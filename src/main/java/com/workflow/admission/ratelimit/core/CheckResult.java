package com.workflow.admission.ratelimit.core;

import java.util.Optional;

/**
 * Outcome of a single limiter check. For admitted requests {@code retryAfterSeconds} holds the
 * seconds left until the current window resets and {@code windowStartMs} names the window that
 * was charged, so a later refund can target it. Checks that charged nothing carry
 * {@link #UNMETERED}.
 */
public record CheckResult(boolean allowed, long remaining, Long retryAfterSeconds, boolean blocked, long windowStartMs) {

    public static final long UNMETERED = -1L;

    public CheckResult {
        remaining = Math.max(0, remaining);
    }

    public static CheckResult allowed(long remaining, long resetSeconds, long windowStartMs) {
        return new CheckResult(true, remaining, resetSeconds, false, windowStartMs);
    }

    /** Admitted without touching any counter, e.g. for a whitelisted identity. */
    public static CheckResult unmetered(long capacity) {
        return new CheckResult(true, capacity, null, false, UNMETERED);
    }

    public static CheckResult blocked(long retryAfterSeconds) {
        return new CheckResult(false, 0, retryAfterSeconds, true, UNMETERED);
    }

    /** Rejected by a deny-list entry; {@code retryAfterSeconds} is null when the entry never expires. */
    public static CheckResult denied(Long retryAfterSeconds) {
        return new CheckResult(false, 0, retryAfterSeconds, true, UNMETERED);
    }

    public static CheckResult exhausted(long retryAfterSeconds) {
        return new CheckResult(false, 0, retryAfterSeconds, false, UNMETERED);
    }

    public boolean metered() { return windowStartMs != UNMETERED; }

    public Optional<Long> retryAfterOpt() { return Optional.ofNullable(retryAfterSeconds); }
}
