package com.workflow.admission.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class AdmissionMetrics {

    public static final String CHECKS = "admission_checks_total";
    public static final String REJECTIONS = "admission_rejections_total";
    public static final String FAIL_OPEN = "admission_fail_open_total";
    public static final String REFUNDS = "admission_refunds_total";

    private final MeterRegistry registry;

    public AdmissionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCheck(String limiter, String outcome) {
        Counter.builder(CHECKS)
                .description("Admission checks by limiter and outcome")
                .tags("limiter", safe(limiter), "outcome", safe(outcome))
                .register(registry)
                .increment();
    }

    public void incrementRateLimitRejection(String limiter) {
        Counter.builder(REJECTIONS)
                .description("Total number of requests rejected by rate limiting")
                .tags("limiter", safe(limiter))
                .register(registry)
                .increment();
    }

    public void recordFailOpen(String reason) {
        Counter.builder(FAIL_OPEN)
                .description("Requests let through because the limiter itself failed")
                .tags("reason", safe(reason))
                .register(registry)
                .increment();
    }

    public void recordRefund(boolean succeeded) {
        Counter.builder(REFUNDS)
                .description("Capacity refunds after the final response status was known")
                .tags("outcome", succeeded ? "ok" : "failed")
                .register(registry)
                .increment();
    }

    private static String safe(String s) {
        return s == null ? "UNKNOWN" : s;
    }
}
