package com.example.docstandards.observability.filter;

import com.example.docstandards.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
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

/**
 * Tags every request with a correlation id.
 *
 * Accepts X-Correlation-Id (or X-Request-Id) from the gateway when it looks like a safe
 * identifier, otherwise generates one. The id is echoed on the response, stored in the
 * Reactor context and put in MDC so request logs can be joined with audit events.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter implements WebFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String REQUEST_PATH_KEY = "requestPath";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String correlationId = extractOrGenerateCorrelationId(exchange.getRequest());
        String requestPath = exchange.getRequest().getPath().value();
        String requestMethod = exchange.getRequest().getMethod().name();

        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        return chain.filter(exchange)
                .contextWrite(Context.of(
                        CORRELATION_ID_KEY, correlationId,
                        REQUEST_PATH_KEY, requestPath
                ))
                .doFirst(() -> {
                    MDC.put(CORRELATION_ID_KEY, correlationId);
                    MDC.put(REQUEST_PATH_KEY, requestPath);
                    log.debug("Request started: {} {}", requestMethod, requestPath);
                })
                .doFinally(signalType -> {
                    log.debug("Request completed: {} {} - {}", requestMethod, requestPath, signalType);
                    MDC.remove(CORRELATION_ID_KEY);
                    MDC.remove(REQUEST_PATH_KEY);
                });
    }

    private String extractOrGenerateCorrelationId(ServerHttpRequest request) {
        String correlationId = StringSanitizer.headerValue(request.getHeaders().getFirst(CORRELATION_ID_HEADER));
        if (StringSanitizer.isValidSafeId(correlationId)) {
            return correlationId;
        }

        String requestId = StringSanitizer.headerValue(request.getHeaders().getFirst(REQUEST_ID_HEADER));
        if (StringSanitizer.isValidSafeId(requestId)) {
            return requestId;
        }

        return UUID.randomUUID().toString();
    }

    /**
     * Correlation id of the current request, "none" outside of a request (e.g. in workers).
     */
    public static Mono<String> getCorrelationId() {
        return Mono.deferContextual(ctx ->
                Mono.just(ctx.getOrDefault(CORRELATION_ID_KEY, "none")));
    }
}
