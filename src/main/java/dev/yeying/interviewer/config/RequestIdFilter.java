package dev.yeying.interviewer.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every request with an id: the caller's {@code X-Request-ID} when well-formed, a fresh one otherwise.
 * The id is echoed in the response and placed in the Reactor context under {@code requestId}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class RequestIdFilter implements WebFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_CONTEXT_KEY = "requestId";

    private static final int MAX_ID_LENGTH = 64;
    private static final Pattern VALID_ID = Pattern.compile("^[a-zA-Z0-9\\-_]+$");

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String supplied = exchange.getRequest().getHeaders().getFirst(REQUEST_ID_HEADER);
        String requestId;
        if (isValid(supplied)) {
            requestId = supplied;
        } else {
            if (supplied != null && !supplied.isBlank()) {
                log.debug("Ignoring malformed {} header", REQUEST_ID_HEADER);
            }
            requestId = UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        }

        ServerWebExchange tagged = exchange.mutate()
                .request(exchange.getRequest().mutate().header(REQUEST_ID_HEADER, requestId).build())
                .build();
        tagged.getResponse().getHeaders().set(REQUEST_ID_HEADER, requestId);

        return chain.filter(tagged).contextWrite(Context.of(REQUEST_ID_CONTEXT_KEY, requestId));
    }

    private boolean isValid(String value) {
        return value != null && !value.isBlank() && value.length() <= MAX_ID_LENGTH
                && VALID_ID.matcher(value).matches();
    }
}
