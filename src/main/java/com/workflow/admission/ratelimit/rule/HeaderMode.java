package com.workflow.admission.ratelimit.rule;

import org.springframework.http.HttpHeaders;

/** Naming of the limit/remaining/reset response headers. */
public enum HeaderMode {
    LEGACY("X-RateLimit-"),
    DRAFT("RateLimit-"),
    NONE(null);

    private final String prefix;

    HeaderMode(String prefix) {
        this.prefix = prefix;
    }

    public void apply(HttpHeaders headers, long limit, long remaining, Long resetSeconds) {
        if (prefix == null) return;
        headers.set(prefix + "Limit", String.valueOf(limit));
        headers.set(prefix + "Remaining", String.valueOf(Math.max(0, remaining)));
        if (resetSeconds != null && resetSeconds > 0) {
            headers.set(prefix + "Reset", String.valueOf(resetSeconds));
        }
    }
}
