package com.workflow.admission.domain;

import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;

import java.util.Optional;

/**
 * Identity attached to the exchange by the upstream authentication layer. Only its id and
 * subscription tier matter here.
 */
public record AuthenticatedPrincipal(String id, String tier) {

    public static final String ATTRIBUTE = AuthenticatedPrincipal.class.getName();

    public static Optional<AuthenticatedPrincipal> from(ServerWebExchange ex) {
        Object attr = ex.getAttribute(ATTRIBUTE);
        if (attr instanceof AuthenticatedPrincipal p && StringUtils.hasText(p.id())) {
            return Optional.of(p);
        }
        return Optional.empty();
    }

    public void attachTo(ServerWebExchange ex) {
        ex.getAttributes().put(ATTRIBUTE, this);
    }
}
