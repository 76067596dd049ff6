package com.workflow.admission.ratelimit.core;

/**
 * State of a counting window after an increment or refund attempt. When {@code accepted} is false
 * the counter was left untouched and {@code hits} is the count that was already there.
 * {@code windowStartMs} identifies the window the hits belong to.
 */
public record WindowHits(boolean accepted, long hits, long windowStartMs, long resetAtMs) {
}
