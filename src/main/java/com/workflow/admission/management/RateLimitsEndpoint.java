package com.workflow.admission.management;

import com.workflow.admission.metrics.AdmissionMetrics;
import com.workflow.admission.ratelimit.core.AccessList;
import com.workflow.admission.ratelimit.core.ConfigurationException;
import com.workflow.admission.ratelimit.core.LimiterConfig;
import com.workflow.admission.ratelimit.core.RateLimitEngine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.endpoint.InvalidEndpointRequestException;
import org.springframework.boot.actuate.endpoint.annotation.DeleteOperation;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.Selector;
import org.springframework.boot.actuate.endpoint.annotation.WriteOperation;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@code /actuator/ratelimits}: registered limiters with admission counters, the consumption of
 * one key, and a manual reset of that key.
 *
 * <p>{@code /actuator/ratelimits/{blacklist|whitelist}} manages the access lists: POST
 * {@code {"identifier": "...", "ttlSeconds": 600}} adds an entry (no ttl means until removed),
 * DELETE {@code ?identifier=...} removes it and GET {@code ?identifier=...} tells whether it is listed.
 */
@Component
@Endpoint(id = "ratelimits")
public class RateLimitsEndpoint {

    private final RateLimitEngine engine;
    private final MeterRegistry registry;

    public RateLimitsEndpoint(RateLimitEngine engine, MeterRegistry registry) {
        this.engine = engine;
        this.registry = registry;
    }

    @ReadOperation
    public Map<String, Object> stats() {
        Map<String, Object> out = new LinkedHashMap<>();

        Map<String, Object> limiters = new TreeMap<>();
        for (String name : engine.registry().names()) {
            LimiterConfig c = engine.registry().get(name);
            limiters.put(name, Map.of(
                    "points", c.points(),
                    "durationSeconds", c.durationSeconds(),
                    "blockDurationSeconds", c.blockDurationSeconds()));
        }
        out.put("limiters", limiters);
        out.put("checks_by_outcome", sumByTag(AdmissionMetrics.CHECKS, "outcome"));
        out.put("rejections_by_limiter", sumByTag(AdmissionMetrics.REJECTIONS, "limiter"));
        out.put("fail_open_by_reason", sumByTag(AdmissionMetrics.FAIL_OPEN, "reason"));
        out.put("refunds_by_outcome", sumByTag(AdmissionMetrics.REFUNDS, "outcome"));
        return out;
    }

    @ReadOperation
    public Mono<Map<String, Object>> consumption(@Selector String limiter, @Selector String key) {
        return engine.getCurrentConsumption(limiter, key)
                .map(c -> {
                    Map<String, Object> out = new LinkedHashMap<>();
                    out.put("limiter", limiter);
                    out.put("key", key);
                    out.put("consumed", c.consumed());
                    out.put("remaining", c.remaining());
                    out.put("blockedUntil", c.blockedUntilMs());
                    return out;
                })
                .onErrorResume(ConfigurationException.class, e -> Mono.empty());
    }

    @DeleteOperation
    public Mono<Map<String, Object>> reset(@Selector String limiter, @Selector String key) {
        return engine.resetLimit(limiter, key)
                .then(Mono.fromSupplier(() -> Map.<String, Object>of("limiter", limiter, "key", key, "reset", true)))
                .onErrorResume(ConfigurationException.class, e -> Mono.empty());
    }

    @ReadOperation
    public Mono<Map<String, Object>> listed(@Selector String list, String identifier) {
        AccessList l = accessList(list);
        return engine.isListed(l, identifier)
                .map(listed -> Map.<String, Object>of("list", l.id(), "identifier", identifier, "listed", listed));
    }

    @WriteOperation
    public Mono<Map<String, Object>> addToList(@Selector String list, String identifier, @Nullable Long ttlSeconds) {
        AccessList l = accessList(list);
        if (ttlSeconds != null && ttlSeconds <= 0) {
            throw new InvalidEndpointRequestException("ttlSeconds must be positive", "ttlSeconds must be positive");
        }
        Duration ttl = ttlSeconds == null ? null : Duration.ofSeconds(ttlSeconds);
        return engine.addToList(l, identifier, ttl)
                .then(Mono.fromSupplier(() -> {
                    Map<String, Object> out = new LinkedHashMap<>();
                    out.put("list", l.id());
                    out.put("identifier", identifier);
                    out.put("listed", true);
                    if (ttlSeconds != null) out.put("ttlSeconds", ttlSeconds);
                    return out;
                }))
                .onErrorMap(IllegalArgumentException.class, RateLimitsEndpoint::invalid);
    }

    @DeleteOperation
    public Mono<Map<String, Object>> removeFromList(@Selector String list, String identifier) {
        AccessList l = accessList(list);
        return engine.removeFromList(l, identifier)
                .then(Mono.fromSupplier(() -> Map.<String, Object>of("list", l.id(), "identifier", identifier, "listed", false)))
                .onErrorMap(IllegalArgumentException.class, RateLimitsEndpoint::invalid);
    }

    private static AccessList accessList(String list) {
        try {
            return AccessList.fromId(list);
        } catch (IllegalArgumentException e) {
            throw new InvalidEndpointRequestException(e.getMessage(), "unknown list '" + list + "'");
        }
    }

    private static InvalidEndpointRequestException invalid(IllegalArgumentException e) {
        return new InvalidEndpointRequestException(e.getMessage(), e.getMessage());
    }

    private Map<String, Double> sumByTag(String meter, String tag) {
        Map<String, Double> out = new TreeMap<>();
        for (Counter c : registry.find(meter).counters()) {
            String value = c.getId().getTag(tag);
            out.merge(value != null ? value : "unknown", c.count(), Double::sum);
        }
        return out;
    }
}
