package com.workflow.admission.ratelimit.rule;

import com.workflow.admission.domain.AuthenticatedPrincipal;
import com.workflow.admission.metrics.AdmissionMetrics;
import com.workflow.admission.ratelimit.core.ConfigurationException;
import com.workflow.admission.ratelimit.core.LimiterConfig;
import com.workflow.admission.ratelimit.core.RateLimitEngine;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Capacity by subscription tier. Each tier counts against its own limiter
 * {@code "<base>:<tier>"}, registered the first time a caller of that tier shows up. Tier labels
 * missing from the table count as the default tier.
 */
public class TieredLimitRule implements AdmissionRule {

    public static final String DEFAULT_TIER = "free";

    private final String baseLimiter;
    private final Map<String, Integer> tierPoints;
    private final long durationSeconds;
    private final long blockDurationSeconds;
    private final String defaultTier;
    private final RuleBuilder template;
    private final RateLimitEngine engine;
    private final AdmissionMetrics metrics;
    private final ConcurrentMap<String, SingleLimitRule> byTier = new ConcurrentHashMap<>();

    public TieredLimitRule(String baseLimiter, Map<String, Integer> tierPoints, long durationSeconds,
                           long blockDurationSeconds, RuleBuilder template,
                           RateLimitEngine engine, AdmissionMetrics metrics) {
        this(baseLimiter, tierPoints, DEFAULT_TIER, durationSeconds, blockDurationSeconds, template, engine, metrics);
    }

    public TieredLimitRule(String baseLimiter, Map<String, Integer> tierPoints, String defaultTier,
                           long durationSeconds, long blockDurationSeconds, RuleBuilder template,
                           RateLimitEngine engine, AdmissionMetrics metrics) {
        if (tierPoints == null || !tierPoints.containsKey(defaultTier)) {
            throw new ConfigurationException("tier table for '" + baseLimiter + "' must define the '" + defaultTier + "' tier");
        }
        tierPoints.forEach((tier, points) -> {
            if (points == null || points <= 0) {
                throw new ConfigurationException("tier '" + tier + "' of '" + baseLimiter + "': points must be > 0");
            }
        });
        this.baseLimiter = baseLimiter;
        this.tierPoints = Map.copyOf(tierPoints);
        this.defaultTier = defaultTier;
        this.durationSeconds = durationSeconds;
        this.blockDurationSeconds = blockDurationSeconds;
        this.template = template;
        this.engine = engine;
        this.metrics = metrics;
        // registered eagerly so that a bad duration fails at startup
        byTier.put(defaultTier, ruleFor(defaultTier));
    }

    @Override
    public Mono<AdmissionDecision> evaluate(ServerWebExchange ex) {
        if (!template.condition().test(ex)) return Mono.just(AdmissionDecision.allow());
        return byTier.computeIfAbsent(resolveTier(ex), this::ruleFor).evaluate(ex);
    }

    String resolveTier(ServerWebExchange ex) {
        return AuthenticatedPrincipal.from(ex)
                .map(AuthenticatedPrincipal::tier)
                .filter(StringUtils::hasText)
                .map(t -> t.trim().toLowerCase(Locale.ROOT))
                .filter(tierPoints::containsKey)
                .orElse(defaultTier);
    }

    public static String limiterName(String base, String tier) {
        return base + ":" + tier;
    }

    private SingleLimitRule ruleFor(String tier) {
        LimiterConfig cfg = engine.registry().createIfAbsent(
                LimiterConfig.of(limiterName(baseLimiter, tier), tierPoints.get(tier), durationSeconds, blockDurationSeconds));
        return template.copyFor(cfg.name())
                .message("Rate limit exceeded for " + tier + " tier.")
                .build(engine, metrics);
    }
}
