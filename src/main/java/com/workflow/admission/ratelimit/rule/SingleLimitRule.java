package com.workflow.admission.ratelimit.rule;

import com.workflow.admission.metrics.AdmissionMetrics;
import com.workflow.admission.ratelimit.core.CheckResult;
import com.workflow.admission.ratelimit.core.ConfigurationException;
import com.workflow.admission.ratelimit.core.Outcome;
import com.workflow.admission.ratelimit.core.RateLimitEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * One limiter applied to matching requests: derive the key, skip whitelisted keys, check the
 * engine, emit the limit headers and, when configured, give the points back once the final
 * response status is known.
 */
public class SingleLimitRule implements AdmissionRule {

    private static final Logger log = LoggerFactory.getLogger(SingleLimitRule.class);

    private final AdmissionPolicy policy;
    private final RateLimitEngine engine;
    private final AdmissionMetrics metrics;

    public SingleLimitRule(AdmissionPolicy policy, RateLimitEngine engine, AdmissionMetrics metrics) {
        engine.registry().get(policy.limiterName());
        if (policy.pointsPerRequest() <= 0) {
            throw new ConfigurationException("rule for '" + policy.limiterName() + "': points per request must be > 0");
        }
        this.policy = policy;
        this.engine = engine;
        this.metrics = metrics;
    }

    public AdmissionPolicy policy() {
        return policy;
    }

    @Override
    public Mono<AdmissionDecision> evaluate(ServerWebExchange ex) {
        if (!policy.condition().test(ex)) return Mono.just(AdmissionDecision.allow());

        final String key;
        try {
            key = policy.keyGenerator().key(ex);
        } catch (RuntimeException e) {
            return Mono.just(RuleFailures.keyFailure(policy.limiterName(), e, metrics));
        }
        if (policy.whitelist().contains(key)) {
            metrics.recordCheck(policy.limiterName(), "whitelisted");
            return Mono.just(AdmissionDecision.allow());
        }

        return engine.tryCheckLimit(policy.limiterName(), key, policy.pointsPerRequest())
                .flatMap(outcome -> {
                    if (outcome instanceof Outcome.Decided<CheckResult> decided) {
                        return Mono.just(decide(ex, key, decided.value()));
                    }
                    Throwable cause = ((Outcome.Failed<CheckResult>) outcome).cause();
                    return RuleFailures.onFailure(policy.limiterName(), cause, metrics);
                });
    }

    private AdmissionDecision decide(ServerWebExchange ex, String key, CheckResult r) {
        long limit = engine.registry().get(policy.limiterName()).points();
        policy.headerMode().apply(ex.getResponse().getHeaders(), limit, r.remaining(), r.retryAfterSeconds());

        if (!r.allowed()) {
            metrics.recordCheck(policy.limiterName(), r.blocked() ? "blocked" : "rejected");
            log.debug("rejected {} on {} (blocked={}, retryAfter={}s)", key, policy.limiterName(), r.blocked(), r.retryAfterSeconds());
            return AdmissionDecision.reject(policy.limiterName(), r.retryAfterSeconds(), r.blocked(),
                    null, policy.message(), policy.status());
        }

        metrics.recordCheck(policy.limiterName(), "allowed");
        if (policy.refundsAnything() && r.metered()) {
            registerRefund(ex, key, r.windowStartMs());
        }
        return AdmissionDecision.allow();
    }

    /** The refund targets the window that admitted the request and is dropped once that window ended. */
    private void registerRefund(ServerWebExchange ex, String key, long windowStartMs) {
        ex.getResponse().beforeCommit(() -> {
            HttpStatusCode sc = ex.getResponse().getStatusCode();
            int status = sc != null ? sc.value() : 200;
            if (policy.shouldRefund(status)) {
                engine.refund(policy.limiterName(), key, policy.pointsPerRequest(), windowStartMs)
                        .subscribe(
                                remaining -> {
                                    metrics.recordRefund(true);
                                    log.debug("refunded {} on {} after status {}, remaining={}", key, policy.limiterName(), status, remaining);
                                },
                                e -> {
                                    metrics.recordRefund(false);
                                    log.warn("refund of {} on {} failed: {}", key, policy.limiterName(), e.toString());
                                });
            }
            return Mono.empty();
        });
    }
}
