package com.workflow.admission.ratelimit.core;

public record LimitRequest(String limiterName, int points) {
    public static LimitRequest of(String limiterName) { return new LimitRequest(limiterName, 1); }
}
