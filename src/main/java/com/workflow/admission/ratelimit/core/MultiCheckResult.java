package com.workflow.admission.ratelimit.core;

import java.util.Optional;

public record MultiCheckResult(boolean allowed, String failedLimit, Long retryAfterSeconds) {

    public static MultiCheckResult passed() { return new MultiCheckResult(true, null, null); }

    public static MultiCheckResult failed(String failedLimit, Long retryAfterSeconds) {
        return new MultiCheckResult(false, failedLimit, retryAfterSeconds);
    }

    public Optional<String> failedLimitOpt() { return Optional.ofNullable(failedLimit); }
}
