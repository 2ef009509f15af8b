package dev.yeying.interviewer.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RequestIdFilter")
class RequestIdFilterTest {

    private RequestIdFilter filter;
    private AtomicReference<String> seenByChain;
    private AtomicReference<String> contextValue;
    private WebFilterChain chain;

    @BeforeEach
    void setUp() {
        filter = new RequestIdFilter();
        seenByChain = new AtomicReference<>();
        contextValue = new AtomicReference<>();
        chain = exchange -> Mono.deferContextual(context -> {
            seenByChain.set(exchange.getRequest().getHeaders().getFirst(RequestIdFilter.REQUEST_ID_HEADER));
            contextValue.set(context.getOrDefault(RequestIdFilter.REQUEST_ID_CONTEXT_KEY, null));
            return Mono.empty();
        });
    }

    @Test
    @DisplayName("should generate an id when none is supplied")
    void shouldGenerateId() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/resumes/trees").build());

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        String requestId = exchange.getResponse().getHeaders().getFirst(RequestIdFilter.REQUEST_ID_HEADER);
        assertThat(requestId).hasSize(16);
        assertThat(seenByChain.get()).isEqualTo(requestId);
        assertThat(contextValue.get()).isEqualTo(requestId);
    }

    @Test
    @DisplayName("should keep a well-formed upstream id")
    void shouldKeepUpstreamId() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/resumes/trees")
                .header(RequestIdFilter.REQUEST_ID_HEADER, "gateway-req_42")
                .build());

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(exchange.getResponse().getHeaders().getFirst(RequestIdFilter.REQUEST_ID_HEADER))
                .isEqualTo("gateway-req_42");
    }

    @Test
    @DisplayName("should replace an id carrying unsafe characters")
    void shouldReplaceUnsafeId() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/resumes/trees")
                .header(RequestIdFilter.REQUEST_ID_HEADER, "abc\r\nSet-Cookie: x")
                .build());

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(exchange.getResponse().getHeaders().getFirst(RequestIdFilter.REQUEST_ID_HEADER))
                .matches("[a-f0-9]{16}");
    }
}
