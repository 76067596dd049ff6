package com.workflow.admission.ratelimit.rule;

import com.workflow.admission.ratelimit.core.Condition;
import com.workflow.admission.ratelimit.core.KeyGenerator;
import org.springframework.http.HttpStatusCode;

import java.util.Set;

public record AdmissionPolicy(
        String limiterName,
        Condition condition,
        KeyGenerator keyGenerator,
        int pointsPerRequest,
        boolean skipSuccessfulRequests,
        boolean skipFailedRequests,
        Set<String> whitelist,
        String message,
        HttpStatusCode status,
        HeaderMode headerMode
) {
    public boolean refundsAnything() {
        return skipSuccessfulRequests || skipFailedRequests;
    }

    public boolean shouldRefund(int statusCode) {
        return (skipSuccessfulRequests && statusCode < 400) || (skipFailedRequests && statusCode >= 400);
    }
}
