package com.workflow.admission.domain;

import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;

import java.util.Optional;

/** Identity claimed in a credential submission (login, password reset), before any verification. */
public record SubmittedCredentials(String email, String username) {

    public static final String ATTRIBUTE = SubmittedCredentials.class.getName();

    public static Optional<SubmittedCredentials> from(ServerWebExchange ex) {
        Object attr = ex.getAttribute(ATTRIBUTE);
        return attr instanceof SubmittedCredentials c ? Optional.of(c) : Optional.empty();
    }

    public Optional<String> identifier() {
        if (StringUtils.hasText(email)) return Optional.of(email.trim());
        if (StringUtils.hasText(username)) return Optional.of(username.trim());
        return Optional.empty();
    }

    public Optional<String> emailOpt() {
        return StringUtils.hasText(email) ? Optional.of(email.trim()) : Optional.empty();
    }

    public boolean isEmpty() {
        return identifier().isEmpty();
    }

    public void attachTo(ServerWebExchange ex) {
        ex.getAttributes().put(ATTRIBUTE, this);
    }
}
