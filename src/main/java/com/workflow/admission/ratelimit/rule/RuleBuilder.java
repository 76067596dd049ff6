package com.workflow.admission.ratelimit.rule;

import com.workflow.admission.metrics.AdmissionMetrics;
import com.workflow.admission.ratelimit.core.Condition;
import com.workflow.admission.ratelimit.core.KeyGenerator;
import com.workflow.admission.ratelimit.core.RateLimitEngine;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;

import java.util.Collection;
import java.util.Set;

public final class RuleBuilder {
    private String limiterName;
    private Condition when = Condition.always();
    private KeyGenerator keygen = KeyGenerator.ip();
    private int points = 1;
    private boolean skipSuccessful;
    private boolean skipFailed;
    private Set<String> whitelist = Set.of();
    private String message = "Too many requests";
    private HttpStatusCode status = HttpStatus.TOO_MANY_REQUESTS;
    private HeaderMode headerMode = HeaderMode.LEGACY;

    private RuleBuilder() {}

    public static RuleBuilder forLimiter(String limiterName) {
        var b = new RuleBuilder();
        b.limiterName = limiterName; return b;
    }
    public RuleBuilder when(Condition c) { this.when = this.when.and(c); return this; }
    public RuleBuilder key(KeyGenerator k) { this.keygen = k; return this; }
    public RuleBuilder points(int p) { this.points = p; return this; }
    public RuleBuilder skipSuccessfulRequests() { this.skipSuccessful = true; return this; }
    public RuleBuilder skipFailedRequests() { this.skipFailed = true; return this; }
    public RuleBuilder whitelist(Collection<String> keys) { this.whitelist = keys == null ? Set.of() : Set.copyOf(keys); return this; }
    public RuleBuilder message(String m) { this.message = m; return this; }
    public RuleBuilder status(int code) { this.status = HttpStatusCode.valueOf(code); return this; }
    public RuleBuilder headers(HeaderMode mode) { this.headerMode = mode; return this; }

    /** Same settings, counted against another limiter. */
    public RuleBuilder copyFor(String otherLimiter) {
        var b = new RuleBuilder();
        b.limiterName = otherLimiter;
        b.when = when;
        b.keygen = keygen;
        b.points = points;
        b.skipSuccessful = skipSuccessful;
        b.skipFailed = skipFailed;
        b.whitelist = whitelist;
        b.message = message;
        b.status = status;
        b.headerMode = headerMode;
        return b;
    }

    Condition condition() { return when; }

    public AdmissionPolicy policy() {
        return new AdmissionPolicy(limiterName, when, keygen, points, skipSuccessful, skipFailed,
                whitelist, message, status, headerMode);
    }

    /** Fails with a ConfigurationException when the limiter is not registered. */
    public SingleLimitRule build(RateLimitEngine engine, AdmissionMetrics metrics) {
        if (engine == null) throw new IllegalStateException("engine is required");
        return new SingleLimitRule(policy(), engine, metrics);
    }
}
