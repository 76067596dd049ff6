package com.workflow.admission.ratelimit.rule;

import com.workflow.admission.metrics.AdmissionMetrics;
import com.workflow.admission.ratelimit.core.ConfigurationException;
import com.workflow.admission.ratelimit.core.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Fail-open handling shared by the rules: a limiter that cannot decide lets the request through.
 * Configuration faults are the exception and are propagated.
 */
final class RuleFailures {

    private static final Logger log = LoggerFactory.getLogger(RuleFailures.class);

    private RuleFailures() {}

    static Mono<AdmissionDecision> onFailure(String limiterName, Throwable cause, AdmissionMetrics metrics) {
        if (cause instanceof ConfigurationException) {
            log.error("limiter {} is misconfigured, rejecting the exchange with an error: {}", limiterName, cause.getMessage());
            return Mono.error(cause);
        }
        String reason = cause instanceof StoreUnavailableException ? "store_unavailable" : "unexpected";
        log.warn("limiter {} failed ({}), letting request through: {}", limiterName, reason, cause.toString());
        metrics.recordFailOpen(reason);
        return Mono.just(AdmissionDecision.allow());
    }

    static AdmissionDecision keyFailure(String limiterName, RuntimeException cause, AdmissionMetrics metrics) {
        log.warn("key derivation for limiter {} failed, letting request through: {}", limiterName, cause.toString());
        metrics.recordFailOpen("key_derivation");
        return AdmissionDecision.allow();
    }
}
