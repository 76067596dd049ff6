package com.workflow.admission.web.filter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workflow.admission.metrics.AdmissionMetrics;
import com.workflow.admission.ratelimit.rule.AdmissionDecision;
import com.workflow.admission.ratelimit.rule.AdmissionRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Runs the admission rules in order. The first rejection answers the request with its status,
 * {@code Retry-After} and a JSON body, and the rest of the chain never runs.
 */
public class AdmissionFilter implements WebFilter, Ordered {

    private static final Logger log = LoggerFactory.getLogger(AdmissionFilter.class);
    private static final String ACTUATOR = "/actuator";

    private final AdmissionRule rules;
    private final AdmissionMetrics metrics;
    private final ObjectMapper mapper;

    public AdmissionFilter(List<? extends AdmissionRule> rules, AdmissionMetrics metrics, ObjectMapper mapper) {
        this.rules = AdmissionRule.firstRejection(rules);
        this.metrics = metrics;
        this.mapper = mapper;
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE + 10;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (HttpMethod.OPTIONS.equals(exchange.getRequest().getMethod()) || isActuator(exchange.getRequest().getPath().value())) {
            return chain.filter(exchange);
        }

        return rules.evaluate(exchange)
                .flatMap(dec -> dec.allowed() ? chain.filter(exchange) : reject(exchange, dec));
    }

    private Mono<Void> reject(ServerWebExchange exchange, AdmissionDecision dec) {
        var resp = exchange.getResponse();
        if (resp.isCommitted()) return Mono.empty();

        resp.setStatusCode(dec.status() != null ? dec.status() : HttpStatus.TOO_MANY_REQUESTS);
        dec.retryAfterOpt().ifPresent(sec -> resp.getHeaders().set(HttpHeaders.RETRY_AFTER, String.valueOf(sec)));
        metrics.incrementRateLimitRejection(dec.limiterName());
        log.debug("{} {} rejected by {}", exchange.getRequest().getMethod(),
                exchange.getRequest().getPath().value(), dec.limiterName());

        try {
            byte[] body = mapper.writeValueAsBytes(RejectionBody.of(dec));
            resp.getHeaders().setContentType(MediaType.APPLICATION_JSON);
            return resp.writeWith(Mono.just(resp.bufferFactory().wrap(body)));
        } catch (JsonProcessingException e) {
            log.warn("could not write rejection body for {}: {}", dec.limiterName(), e.getMessage());
            return resp.setComplete();
        }
    }

    static boolean isActuator(String path) {
        return path.equals(ACTUATOR) || path.startsWith(ACTUATOR + "/");
    }
}
