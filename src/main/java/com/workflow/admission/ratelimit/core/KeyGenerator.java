package com.workflow.admission.ratelimit.core;

import com.workflow.admission.domain.AuthenticatedPrincipal;
import com.workflow.admission.domain.SubmittedCredentials;
import org.springframework.http.HttpMethod;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;

import java.util.Locale;

/**
 * Maps a request to the identity a limiter counts against. Implementations are pure and fall
 * back to the client address instead of throwing.
 */
@FunctionalInterface
public interface KeyGenerator {
    String key(ServerWebExchange ex);

    String UNKNOWN = "unknown";

    static KeyGenerator constant(String c) { return ex -> c; }

    /** First X-Forwarded-For hop, then X-Real-IP, then the socket address. */
    static KeyGenerator ip() {
        return ex -> {
            var headers = ex.getRequest().getHeaders();
            String xff = headers.getFirst("X-Forwarded-For");
            if (StringUtils.hasText(xff)) {
                String first = xff.split(",")[0].trim();
                if (StringUtils.hasText(first)) return first;
            }
            String realIp = headers.getFirst("X-Real-IP");
            if (StringUtils.hasText(realIp)) return realIp.trim();
            var ra = ex.getRequest().getRemoteAddress();
            if (ra != null && ra.getAddress() != null) return ra.getAddress().getHostAddress();
            if (ra != null && StringUtils.hasText(ra.getHostString())) return ra.getHostString();
            return UNKNOWN;
        };
    }

    static KeyGenerator user() {
        KeyGenerator ip = ip();
        return ex -> AuthenticatedPrincipal.from(ex)
                .map(p -> "user:" + p.id())
                .orElseGet(() -> ip.key(ex));
    }

    static KeyGenerator apiKey() {
        KeyGenerator ip = ip();
        return ex -> {
            String k = ex.getRequest().getHeaders().getFirst("X-API-Key");
            if (!StringUtils.hasText(k)) k = ex.getRequest().getQueryParams().getFirst("api_key");
            return StringUtils.hasText(k) ? "api:" + k.trim() : ip.key(ex);
        };
    }

    static KeyGenerator combined() {
        KeyGenerator ip = ip();
        return ex -> {
            String addr = ip.key(ex);
            return AuthenticatedPrincipal.from(ex)
                    .map(p -> "user:" + p.id() + ":" + addr)
                    .orElse(addr);
        };
    }

    static KeyGenerator endpoint() {
        return endpoint(ip());
    }

    static KeyGenerator endpoint(KeyGenerator base) {
        return ex -> {
            HttpMethod m = ex.getRequest().getMethod();
            return base.key(ex) + ":" + (m != null ? m.name() : "UNKNOWN") + ":" + ex.getRequest().getPath().value();
        };
    }

    /**
     * Keys on the identity claimed in the submitted credentials so that rotating source
     * addresses does not reset the count for an account under attack. The identity is
     * lower-cased, so changing its letter case does not either.
     */
    static KeyGenerator login() {
        KeyGenerator ip = ip();
        return ex -> "login:" + SubmittedCredentials.from(ex)
                .flatMap(SubmittedCredentials::identifier)
                .map(id -> id.toLowerCase(Locale.ROOT))
                .orElseGet(() -> ip.key(ex));
    }

    static KeyGenerator passwordReset() {
        KeyGenerator ip = ip();
        return ex -> "reset:" + SubmittedCredentials.from(ex)
                .flatMap(SubmittedCredentials::emailOpt)
                .map(email -> email.toLowerCase(Locale.ROOT))
                .orElseGet(() -> ip.key(ex));
    }

    /** Webhook id from X-Webhook-Id or the path segment right after {@code pathPrefix}. */
    static KeyGenerator webhook(String pathPrefix) {
        KeyGenerator ip = ip();
        return ex -> {
            String id = ex.getRequest().getHeaders().getFirst("X-Webhook-Id");
            if (!StringUtils.hasText(id)) {
                String path = ex.getRequest().getPath().value();
                if (path.startsWith(pathPrefix)) {
                    String rest = path.substring(pathPrefix.length());
                    if (rest.startsWith("/")) rest = rest.substring(1);
                    int slash = rest.indexOf('/');
                    id = slash >= 0 ? rest.substring(0, slash) : rest;
                }
            }
            return "webhook:" + (StringUtils.hasText(id) ? id.trim() : ip.key(ex));
        };
    }
}
