package com.chanakya.vault.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.UUID;
import java.util.regex.Pattern;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestTracingFilter implements WebFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestTracingFilter.class);

    static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    static final String CORRELATION_ID_KEY = "correlationId";

    private static final Pattern TIMELINE_TOKEN = Pattern.compile("^(/api/timeline/)[^/]+");

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String incoming = exchange.getRequest().getHeaders().getFirst(CORRELATION_ID_HEADER);
        String correlationId = incoming == null || incoming.isBlank()
                ? UUID.randomUUID().toString()
                : incoming;

        ServerHttpRequest request = exchange.getRequest().mutate()
                .header(CORRELATION_ID_HEADER, correlationId)
                .build();
        ServerWebExchange traced = exchange.mutate().request(request).build();
        traced.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        String method = request.getMethod().name();
        String path = maskPath(request.getPath().value());
        long startedAt = System.nanoTime();

        return chain.filter(traced)
                .contextWrite(Context.of(CORRELATION_ID_KEY, correlationId))
                .doFirst(() -> MDC.put(CORRELATION_ID_KEY, correlationId))
                .doFinally(signal -> {
                    log.info("event=http_request method={} path={} status={} durationMs={} correlationId={}",
                            method, path, traced.getResponse().getStatusCode(),
                            (System.nanoTime() - startedAt) / 1_000_000, correlationId);
                    MDC.remove(CORRELATION_ID_KEY);
                });
    }

    /**
     * Viewer tokens are bearer secrets and must not reach the logs.
     */
    static String maskPath(String path) {
        return TIMELINE_TOKEN.matcher(path).replaceFirst("$1***");
    }
}
