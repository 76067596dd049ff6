package com.workflow.admission.ratelimit.rule;

import org.springframework.http.HttpStatusCode;

import java.util.Optional;

public record AdmissionDecision(
        boolean allowed,
        String limiterName,
        Long retryAfterSeconds,
        Boolean blocked,
        String limitType,
        String message,
        HttpStatusCode status
) {
    private static final AdmissionDecision ALLOW = new AdmissionDecision(true, null, null, null, null, null, null);

    public static AdmissionDecision allow() { return ALLOW; }

    public static AdmissionDecision reject(String limiterName, Long retryAfterSeconds, Boolean blocked,
                                           String limitType, String message, HttpStatusCode status) {
        return new AdmissionDecision(false, limiterName, retryAfterSeconds, blocked, limitType, message, status);
    }

    public Optional<Long> retryAfterOpt() {
        return Optional.ofNullable(retryAfterSeconds).filter(s -> s > 0);
    }
}
