package com.example.bugstream.shared.config;

import com.example.bugstream.shared.util.IdGenerator;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Puts the request's correlation id in the MDC and on the exchange, generating one when the
 * caller sent none. The id is echoed back on the response, including WebSocket upgrades.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter implements WebFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_KEY = "correlation_id";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String incoming = exchange.getRequest().getHeaders().getFirst(CORRELATION_ID_HEADER);
        String correlationId = StringUtils.hasText(incoming) ? incoming : IdGenerator.correlationId();

        exchange.getAttributes().put(CORRELATION_ID_KEY, correlationId);
        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        MDC.put(CORRELATION_ID_KEY, correlationId);
        return chain.filter(exchange)
                .doFinally(signalType -> MDC.remove(CORRELATION_ID_KEY));
    }
}
