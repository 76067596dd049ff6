package com.workflow.admission.ratelimit.core;

public class RefundException extends RuntimeException {
    private final String limiterName;

    public RefundException(String limiterName, Throwable cause) {
        super("Refund failed for limiter '" + limiterName + "'", cause);
        this.limiterName = limiterName;
    }

    public String getLimiterName() {
        return limiterName;
    }
}
