package dev.yeying.interviewer.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TrustedIdentityAuthenticationConverter")
class TrustedIdentityAuthenticationConverterTest {

    private final TrustedIdentityAuthenticationConverter converter =
            new TrustedIdentityAuthenticationConverter("X-Authenticated-Identity");

    @Test
    @DisplayName("should authenticate the forwarded identity")
    void shouldAuthenticateForwardedIdentity() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/resumes/trees")
                .header("X-Authenticated-Identity", " 0xA11CE ")
                .build());

        StepVerifier.create(converter.convert(exchange))
                .assertNext(authentication -> {
                    assertThat(authentication.isAuthenticated()).isTrue();
                    assertThat(authentication.getName()).isEqualTo("0xA11CE");
                    assertThat(authentication.getAuthorities()).extracting(Object::toString).containsExactly("ROLE_USER");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should yield nothing without the header")
    void shouldSkipMissingHeader() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/resumes/trees").build());

        StepVerifier.create(converter.convert(exchange)).verifyComplete();
    }

    @Test
    @DisplayName("should ignore an oversized identity")
    void shouldSkipOversizedIdentity() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/resumes/trees")
                .header("X-Authenticated-Identity", "a".repeat(TrustedIdentityAuthenticationConverter.MAX_IDENTITY_LENGTH + 1))
                .build());

        StepVerifier.create(converter.convert(exchange)).verifyComplete();
    }

    @Test
    @DisplayName("should read the configured header name")
    void shouldHonourConfiguredHeader() {
        TrustedIdentityAuthenticationConverter custom = new TrustedIdentityAuthenticationConverter("X-User");
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/resumes/trees")
                .header("X-User", "bob")
                .header("X-Authenticated-Identity", "alice")
                .build());

        StepVerifier.create(custom.convert(exchange))
                .assertNext(authentication -> assertThat(authentication.getName()).isEqualTo("bob"))
                .verifyComplete();
    }
}
