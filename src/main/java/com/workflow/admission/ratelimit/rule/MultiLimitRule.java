package com.workflow.admission.ratelimit.rule;

import com.workflow.admission.metrics.AdmissionMetrics;
import com.workflow.admission.ratelimit.core.Condition;
import com.workflow.admission.ratelimit.core.ConfigurationException;
import com.workflow.admission.ratelimit.core.KeyGenerator;
import com.workflow.admission.ratelimit.core.LimitRequest;
import com.workflow.admission.ratelimit.core.MultiCheckResult;
import com.workflow.admission.ratelimit.core.Outcome;
import com.workflow.admission.ratelimit.core.RateLimitEngine;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.List;

/** Several limiters that must all admit the request, checked in the given order. */
public class MultiLimitRule implements AdmissionRule {

    public static final String DEFAULT_MESSAGE = "Rate limit exceeded";

    public record LimitSpec(String limiterName, int points, String message) {
        public static LimitSpec of(String limiterName, String message) { return new LimitSpec(limiterName, 1, message); }
    }

    private final List<LimitSpec> limits;
    private final List<LimitRequest> requests;
    private final Condition when;
    private final KeyGenerator keygen;
    private final RateLimitEngine engine;
    private final AdmissionMetrics metrics;
    private final String name;

    public MultiLimitRule(List<LimitSpec> limits, RateLimitEngine engine, AdmissionMetrics metrics) {
        this(limits, Condition.always(), KeyGenerator.ip(), engine, metrics);
    }

    public MultiLimitRule(List<LimitSpec> limits, Condition when, KeyGenerator keygen,
                          RateLimitEngine engine, AdmissionMetrics metrics) {
        if (limits == null || limits.isEmpty()) throw new ConfigurationException("at least one limit is required");
        limits.forEach(l -> {
            engine.registry().get(l.limiterName());
            if (l.points() <= 0) throw new ConfigurationException("limit '" + l.limiterName() + "': points must be > 0");
        });
        this.limits = List.copyOf(limits);
        this.requests = limits.stream().map(l -> new LimitRequest(l.limiterName(), l.points())).toList();
        this.when = when;
        this.keygen = keygen;
        this.engine = engine;
        this.metrics = metrics;
        this.name = String.join("+", limits.stream().map(LimitSpec::limiterName).toList());
    }

    @Override
    public Mono<AdmissionDecision> evaluate(ServerWebExchange ex) {
        if (!when.test(ex)) return Mono.just(AdmissionDecision.allow());

        final String key;
        try {
            key = keygen.key(ex);
        } catch (RuntimeException e) {
            return Mono.just(RuleFailures.keyFailure(name, e, metrics));
        }

        return engine.tryCheckMultipleLimits(requests, key)
                .flatMap(outcome -> {
                    if (outcome instanceof Outcome.Decided<MultiCheckResult> decided) {
                        return Mono.just(decide(decided.value()));
                    }
                    Throwable cause = ((Outcome.Failed<MultiCheckResult>) outcome).cause();
                    return RuleFailures.onFailure(name, cause, metrics);
                });
    }

    private AdmissionDecision decide(MultiCheckResult r) {
        if (r.allowed()) {
            metrics.recordCheck(name, "allowed");
            return AdmissionDecision.allow();
        }
        metrics.recordCheck(r.failedLimit(), "rejected");
        String message = limits.stream()
                .filter(l -> l.limiterName().equals(r.failedLimit()))
                .map(LimitSpec::message)
                .filter(m -> m != null && !m.isBlank())
                .findFirst()
                .orElse(DEFAULT_MESSAGE);
        return AdmissionDecision.reject(r.failedLimit(), r.retryAfterSeconds(), null,
                r.failedLimit(), message, HttpStatus.TOO_MANY_REQUESTS);
    }
}
