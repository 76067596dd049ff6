package com.workflow.admission.ratelimit.core;

import com.workflow.admission.domain.AuthenticatedPrincipal;
import org.springframework.http.HttpMethod;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.server.ServerWebExchange;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/** Decides whether a rule applies to an exchange at all. */
@FunctionalInterface
public interface Condition extends Predicate<ServerWebExchange> {

    @Override
    boolean test(ServerWebExchange ex);

    default Condition and(Condition other) {
        Objects.requireNonNull(other);
        return ex -> this.test(ex) && other.test(ex);
    }

    default Condition not() {
        return ex -> !this.test(ex);
    }

    static Condition always() {
        return ex -> true;
    }

    static Condition methodIs(HttpMethod method) {
        return ex -> method.equals(ex.getRequest().getMethod());
    }

    static Condition methodIn(HttpMethod... methods) {
        var allowed = List.of(methods);
        return ex -> allowed.contains(ex.getRequest().getMethod());
    }

    /** Applies when the path matches any of the Ant-style patterns. */
    static Condition pathMatches(String... patterns) {
        var matcher = new AntPathMatcher();
        var all = List.of(patterns);
        return ex -> {
            String path = ex.getRequest().getPath().value();
            return all.stream().anyMatch(p -> matcher.match(p, path));
        };
    }

    static Condition pathStartsWith(String prefix) {
        return ex -> ex.getRequest().getPath().value().startsWith(prefix);
    }

    static Condition authenticated() {
        return ex -> AuthenticatedPrincipal.from(ex).isPresent();
    }

    static Condition anonymous() {
        return authenticated().not();
    }
}
