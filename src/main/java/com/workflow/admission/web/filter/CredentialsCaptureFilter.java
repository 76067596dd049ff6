package com.workflow.admission.web.filter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workflow.admission.domain.SubmittedCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequestDecorator;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Reads the email/username submitted to credential endpoints and attaches it to the exchange as
 * {@link SubmittedCredentials}, so that login and password-reset limiters can key on the account
 * under attack. JSON bodies are buffered and replayed to the handler.
 */
public class CredentialsCaptureFilter implements WebFilter, Ordered {

    private static final Logger log = LoggerFactory.getLogger(CredentialsCaptureFilter.class);
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private final List<String> pathPrefixes;
    private final int maxBodyBytes;
    private final ObjectMapper mapper;

    public CredentialsCaptureFilter(List<String> pathPrefixes, int maxBodyBytes, ObjectMapper mapper) {
        this.pathPrefixes = List.copyOf(pathPrefixes);
        this.maxBodyBytes = maxBodyBytes;
        this.mapper = mapper;
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE + 5;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        var req = exchange.getRequest();
        if (!HttpMethod.POST.equals(req.getMethod()) || !applies(req.getPath().value())) {
            return chain.filter(exchange);
        }
        MediaType type = req.getHeaders().getContentType();
        if (MediaType.APPLICATION_FORM_URLENCODED.isCompatibleWith(type)) {
            return exchange.getFormData()
                    .doOnNext(form -> capture(exchange, form.getFirst("email"), form.getFirst("username")))
                    .then(chain.filter(exchange));
        }
        if (type != null && !MediaType.APPLICATION_JSON.isCompatibleWith(type)) {
            return chain.filter(exchange);
        }

        return DataBufferUtils.join(req.getBody(), maxBodyBytes)
                .onErrorMap(DataBufferLimitException.class,
                        e -> new ResponseStatusException(HttpStatus.PAYLOAD_TOO_LARGE, "request body too large"))
                .map(buf -> {
                    byte[] bytes = new byte[buf.readableByteCount()];
                    buf.read(bytes);
                    DataBufferUtils.release(buf);
                    return bytes;
                })
                .defaultIfEmpty(new byte[0])
                .flatMap(bytes -> {
                    parse(exchange, bytes);
                    return chain.filter(exchange.mutate().request(replay(exchange, bytes)).build());
                });
    }

    private boolean applies(String path) {
        return pathPrefixes.stream().anyMatch(path::startsWith);
    }

    private void parse(ServerWebExchange exchange, byte[] bytes) {
        if (bytes.length == 0) return;
        try {
            Map<String, Object> json = mapper.readValue(bytes, JSON_OBJECT);
            capture(exchange, text(json.get("email")), text(json.get("username")));
        } catch (IOException e) {
            log.debug("unparsable credentials body on {}: {}", exchange.getRequest().getPath().value(), e.getMessage());
        }
    }

    private static void capture(ServerWebExchange exchange, String email, String username) {
        var creds = new SubmittedCredentials(email, username);
        if (!creds.isEmpty()) creds.attachTo(exchange);
    }

    private static String text(Object v) {
        return v instanceof String s ? s : null;
    }

    private static ServerHttpRequestDecorator replay(ServerWebExchange exchange, byte[] bytes) {
        return new ServerHttpRequestDecorator(exchange.getRequest()) {
            @Override
            public Flux<DataBuffer> getBody() {
                return Flux.defer(() -> Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(bytes)));
            }
        };
    }
}
