package com.workflow.admission.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.workflow.admission.metrics.AdmissionMetrics;
import com.workflow.admission.ratelimit.core.Condition;
import com.workflow.admission.ratelimit.core.KeyGenerator;
import com.workflow.admission.ratelimit.core.LimiterRegistry;
import com.workflow.admission.ratelimit.core.RateLimitEngine;
import com.workflow.admission.ratelimit.core.WindowStore;
import com.workflow.admission.ratelimit.memory.MemoryWindowStore;
import com.workflow.admission.ratelimit.resilience.ResilientWindowStore;
import com.workflow.admission.ratelimit.rule.AdmissionRule;
import com.workflow.admission.ratelimit.rule.MultiLimitRule;
import com.workflow.admission.ratelimit.rule.MultiLimitRule.LimitSpec;
import com.workflow.admission.ratelimit.rule.RuleBuilder;
import com.workflow.admission.ratelimit.rule.TieredLimitRule;
import com.workflow.admission.web.filter.AdmissionFilter;
import com.workflow.admission.web.filter.CredentialsCaptureFilter;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;

import java.time.Clock;
import java.util.List;

@Configuration
public class RateLimitConfig {

    public static final String PATH_API = "/api/**";
    public static final String PATH_LOGIN = "/api/auth/login";
    public static final String PATH_AUTH = "/api/auth/**";
    public static final String PATH_PASSWORD_RESET = "/api/auth/password-reset/**";
    public static final String PATH_WEBHOOKS = "/api/webhooks";
    public static final String PATH_UPLOADS = "/api/uploads/**";
    public static final String PATH_EXPORT = "/api/**/export";
    public static final String PATH_EXECUTE = "/api/workflows/*/execute";
    public static final String PATH_API_KEYS = "/api/keys";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "admission.rate-limiter.backend", havingValue = "memory", matchIfMissing = true)
    public WindowStore memoryWindowStore(Clock clock) {
        return new MemoryWindowStore(clock);
    }

    @Bean
    public LimiterRegistry limiterRegistry(RateLimiterProperties props) {
        var registry = new LimiterRegistry();
        props.limiters().forEach((name, spec) -> registry.register(spec.toConfig(name)));
        return registry;
    }

    @Bean
    public RateLimitEngine rateLimitEngine(LimiterRegistry registry, WindowStore store, Clock clock,
                                           RateLimiterProperties props,
                                           CircuitBreakerRegistry cbRegistry,
                                           TimeLimiterRegistry tlRegistry) {
        var storeProps = props.store();
        WindowStore effective = storeProps.resilient()
                ? new ResilientWindowStore(store,
                        cbRegistry.circuitBreaker(storeProps.instanceName()),
                        tlRegistry.timeLimiter(storeProps.instanceName()))
                : store;
        return new RateLimitEngine(registry, effective, clock);
    }

    @Bean
    @Order(10)
    public AdmissionRule loginRule(RateLimitEngine engine, AdmissionMetrics metrics, RateLimiterProperties props) {
        return rule("login", props)
                .when(Condition.methodIs(HttpMethod.POST).and(Condition.pathMatches(PATH_LOGIN)))
                .key(KeyGenerator.login())
                .skipSuccessfulRequests()
                .message("Too many login attempts. Please try again later.")
                .build(engine, metrics);
    }

    @Bean
    @Order(20)
    public AdmissionRule authRule(RateLimitEngine engine, AdmissionMetrics metrics, RateLimiterProperties props) {
        return rule("auth", props)
                .when(Condition.methodIs(HttpMethod.POST).and(Condition.pathMatches(PATH_AUTH)))
                .skipSuccessfulRequests()
                .message("Too many authentication attempts. Please try again later.")
                .build(engine, metrics);
    }

    @Bean
    @Order(30)
    public AdmissionRule passwordResetRule(RateLimitEngine engine, AdmissionMetrics metrics, RateLimiterProperties props) {
        return rule("password-reset", props)
                .when(Condition.methodIs(HttpMethod.POST).and(Condition.pathMatches(PATH_PASSWORD_RESET)))
                .key(KeyGenerator.passwordReset())
                .message("Too many password reset requests. Please try again later.")
                .build(engine, metrics);
    }

    @Bean
    @Order(40)
    public AdmissionRule webhookRule(RateLimitEngine engine, AdmissionMetrics metrics, RateLimiterProperties props) {
        return rule("webhook", props)
                .when(Condition.pathStartsWith(PATH_WEBHOOKS))
                .key(KeyGenerator.webhook(PATH_WEBHOOKS))
                .message("Webhook rate limit exceeded.")
                .build(engine, metrics);
    }

    @Bean
    @Order(50)
    public AdmissionRule uploadRule(RateLimitEngine engine, AdmissionMetrics metrics) {
        return new MultiLimitRule(
                List.of(LimitSpec.of("upload-burst", "Too many uploads in a short time. Slow down."),
                        LimitSpec.of("upload", "File upload rate limit exceeded.")),
                Condition.methodIn(HttpMethod.POST, HttpMethod.PUT).and(Condition.pathMatches(PATH_UPLOADS)),
                KeyGenerator.user(),
                engine, metrics);
    }

    @Bean
    @Order(60)
    public AdmissionRule exportRule(RateLimitEngine engine, AdmissionMetrics metrics, RateLimiterProperties props) {
        return rule("export", props)
                .when(Condition.pathMatches(PATH_EXPORT))
                .key(KeyGenerator.user())
                .message("Export rate limit exceeded. Please wait before exporting more data.")
                .build(engine, metrics);
    }

    @Bean
    @Order(70)
    public AdmissionRule executionRule(RateLimitEngine engine, AdmissionMetrics metrics, RateLimiterProperties props) {
        return rule("execution", props)
                .when(Condition.methodIs(HttpMethod.POST).and(Condition.pathMatches(PATH_EXECUTE)))
                .key(KeyGenerator.user())
                .message("Workflow execution rate limit exceeded. Please wait before executing more workflows.")
                .build(engine, metrics);
    }

    @Bean
    @Order(80)
    public AdmissionRule apiKeyRule(RateLimitEngine engine, AdmissionMetrics metrics, RateLimiterProperties props) {
        return rule("api-key", props)
                .when(Condition.methodIs(HttpMethod.POST).and(Condition.pathMatches(PATH_API_KEYS)))
                .key(KeyGenerator.user())
                .message("API key generation limit exceeded.")
                .build(engine, metrics);
    }

    /**
     * One limiter per HTTP method for anonymous callers, counted per address. Authenticated callers
     * are bounded by their tier instead.
     */
    @Bean
    @Order(90)
    public AdmissionRule methodRules(RateLimitEngine engine, AdmissionMetrics metrics, RateLimiterProperties props) {
        return AdmissionRule.firstRejection(List.of(
                methodRule("api-get", HttpMethod.GET, engine, metrics, props),
                methodRule("api-post", HttpMethod.POST, engine, metrics, props),
                methodRule("api-put", HttpMethod.PUT, engine, metrics, props),
                methodRule("api-patch", HttpMethod.PATCH, engine, metrics, props),
                methodRule("api-delete", HttpMethod.DELETE, engine, metrics, props)));
    }

    @Bean
    @Order(100)
    public AdmissionRule anonymousApiRule(RateLimitEngine engine, AdmissionMetrics metrics, RateLimiterProperties props) {
        return rule("api", props)
                .when(Condition.pathMatches(PATH_API).and(Condition.anonymous()))
                .message("API rate limit exceeded.")
                .build(engine, metrics);
    }

    @Bean
    @Order(110)
    public AdmissionRule tieredApiRule(RateLimitEngine engine, AdmissionMetrics metrics, RateLimiterProperties props) {
        var tiers = props.tiers();
        return new TieredLimitRule("api", tiers.points(), tiers.defaultTier(),
                tiers.duration().toSeconds(), tiers.blockDurationSeconds(),
                rule("api", props)
                        .when(Condition.pathMatches(PATH_API).and(Condition.authenticated()))
                        .key(KeyGenerator.user()),
                engine, metrics);
    }

    @Bean
    public AdmissionFilter admissionFilter(List<AdmissionRule> rules, AdmissionMetrics metrics, ObjectMapper mapper) {
        return new AdmissionFilter(rules, metrics, mapper);
    }

    @Bean
    public CredentialsCaptureFilter credentialsCaptureFilter(RateLimiterProperties props, ObjectMapper mapper) {
        var creds = props.credentials();
        return new CredentialsCaptureFilter(creds.paths(), (int) creds.maxBody().toBytes(), mapper);
    }

    private static AdmissionRule methodRule(String limiter, HttpMethod method, RateLimitEngine engine,
                                            AdmissionMetrics metrics, RateLimiterProperties props) {
        return rule(limiter, props)
                .when(Condition.pathMatches(PATH_API).and(Condition.methodIs(method)).and(Condition.anonymous()))
                .key(KeyGenerator.ip())
                .message(method.name() + " rate limit exceeded.")
                .build(engine, metrics);
    }

    private static RuleBuilder rule(String limiter, RateLimiterProperties props) {
        return RuleBuilder.forLimiter(limiter)
                .whitelist(props.whitelist())
                .headers(props.headerMode());
    }
}
