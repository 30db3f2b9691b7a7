package com.example.bugstream.shared.config;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @Test
    void propagatesIncomingHeader() {
        MockServerWebExchange exchange = MockServerWebExchange.from(
                MockServerHttpRequest.get("/api/stream-admin/stats").header(CorrelationIdFilter.CORRELATION_ID_HEADER, "abc-123"));
        AtomicReference<String> seenInMdc = new AtomicReference<>();
        WebFilterChain chain = ex -> {
            seenInMdc.set(MDC.get(CorrelationIdFilter.CORRELATION_ID_KEY));
            return Mono.empty();
        };

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(seenInMdc.get()).isEqualTo("abc-123");
        assertThat((String) exchange.getAttribute(CorrelationIdFilter.CORRELATION_ID_KEY)).isEqualTo("abc-123");
        assertThat(MDC.get(CorrelationIdFilter.CORRELATION_ID_KEY)).isNull();
    }

    @Test
    void generatesIdWhenHeaderMissing() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/"));

        StepVerifier.create(filter.filter(exchange, ex -> Mono.empty())).verifyComplete();

        String generated = exchange.getAttribute(CorrelationIdFilter.CORRELATION_ID_KEY);
        assertThat(generated).startsWith("corr_");
        assertThat(exchange.getResponse().getHeaders().getFirst(CorrelationIdFilter.CORRELATION_ID_HEADER))
                .isEqualTo(generated);
    }
}
