package com.workflow.admission.ratelimit.rule;

import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@FunctionalInterface
public interface AdmissionRule {
    Mono<AdmissionDecision> evaluate(ServerWebExchange exchange);

    /** Evaluates {@code rules} in order and stops at the first rejection. */
    static AdmissionRule firstRejection(List<? extends AdmissionRule> rules) {
        List<AdmissionRule> ordered = List.copyOf(rules);
        return ex -> Flux.fromIterable(ordered)
                .concatMap(rule -> rule.evaluate(ex))
                .filter(dec -> !dec.allowed())
                .next()
                .defaultIfEmpty(AdmissionDecision.allow());
    }
}
