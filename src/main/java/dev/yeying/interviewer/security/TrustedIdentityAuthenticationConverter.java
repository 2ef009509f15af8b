package dev.yeying.interviewer.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.web.server.authentication.ServerAuthenticationConverter;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Turns the identity header set by the upstream gateway into an authenticated principal.
 * Credentials are verified by the gateway; this service only trusts the forwarded identity.
 */
@Component
@Slf4j
public class TrustedIdentityAuthenticationConverter implements ServerAuthenticationConverter {

    static final int MAX_IDENTITY_LENGTH = 128;

    private final String identityHeader;

    public TrustedIdentityAuthenticationConverter(
            @Value("${app.security.identity-header:X-Authenticated-Identity}") String identityHeader) {
        this.identityHeader = identityHeader;
    }

    @Override
    public Mono<Authentication> convert(ServerWebExchange exchange) {
        String identity = exchange.getRequest().getHeaders().getFirst(identityHeader);
        if (identity == null || identity.isBlank()) {
            return Mono.empty();
        }
        String trimmed = identity.trim();
        if (trimmed.length() > MAX_IDENTITY_LENGTH) {
            log.warn("Rejected oversized {} header ({} chars)", identityHeader, trimmed.length());
            return Mono.empty();
        }
        return Mono.just(UsernamePasswordAuthenticationToken.authenticated(
                trimmed, null, List.of(new SimpleGrantedAuthority("ROLE_USER"))));
    }
}
