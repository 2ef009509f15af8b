package dev.yeying.interviewer.exception;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.MessageSource;
import org.springframework.context.i18n.SimpleLocaleContext;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.RequestPath;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    @Mock
    private MessageSource messageSource;

    @Mock
    private ServerWebExchange exchange;

    @Mock
    private ServerHttpRequest request;

    @Mock
    private RequestPath requestPath;

    @InjectMocks
    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        lenient().when(exchange.getRequest()).thenReturn(request);
        lenient().when(exchange.getLocaleContext()).thenReturn(new SimpleLocaleContext(Locale.ENGLISH));
        lenient().when(request.getPath()).thenReturn(requestPath);
        lenient().when(requestPath.value()).thenReturn("/api/v1/resumes/42");
        // echo the key back
        lenient().when(messageSource.getMessage(anyString(), any(), anyString(), any(Locale.class)))
                .thenAnswer(inv -> inv.getArgument(0));
    }

    @Nested
    @DisplayName("handleResumeTreeException()")
    class HandleResumeTreeException {

        @Test
        @DisplayName("should map not-found to 404 with the exception message")
        void shouldMapNotFound() {
            StepVerifier.create(handler.handleResumeTreeException(new ResourceNotFoundException("Resume", 42L), exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
                        assertThat(response.getBody()).isNotNull();
                        assertThat(response.getBody().getKind()).isEqualTo("NOT_FOUND");
                        assertThat(response.getBody().getMessage()).isEqualTo("Resume not found: 42");
                        assertThat(response.getBody().getError()).isEqualTo("error.not_found");
                        assertThat(response.getBody().getPath()).isEqualTo("/api/v1/resumes/42");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should map depth limit and not-published to 409")
        void shouldMapConflicts() {
            StepVerifier.create(handler.handleResumeTreeException(new DepthLimitExceededException(42L, 5), exchange))
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT))
                    .verifyComplete();
            StepVerifier.create(handler.handleResumeTreeException(new NotPublishedException(42L), exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                        assertThat(response.getBody().getKind()).isEqualTo("NOT_PUBLISHED");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should map permission denied to 403")
        void shouldMapPermissionDenied() {
            StepVerifier.create(handler.handleResumeTreeException(new PermissionDeniedException("resume 42"), exchange))
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should hide storage details behind a generic 503 message")
        void shouldHideStorageDetails() {
            StorageFailureException ex = new StorageFailureException("fork",
                    new DataAccessResourceFailureException("jdbc://secret-host refused"));

            StepVerifier.create(handler.handleResumeTreeException(ex, exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
                        assertThat(response.getBody().getMessage()).isEqualTo("error.storage_unavailable");
                        assertThat(response.getBody().getKind()).isEqualTo("STORAGE_FAILURE");
                    })
                    .verifyComplete();
        }
    }

    @Test
    @DisplayName("should collect field errors from request body validation")
    void shouldCollectFieldErrors() {
        BindingResult bindingResult = mock(BindingResult.class);
        when(bindingResult.getFieldErrors()).thenReturn(List.of(
                new FieldError("createResumeRequest", "name", "must not be blank")));
        WebExchangeBindException ex = mock(WebExchangeBindException.class);
        when(ex.getBindingResult()).thenReturn(bindingResult);

        StepVerifier.create(handler.handleValidationErrors(ex, exchange))
                .assertNext(body -> {
                    assertThat(body.getStatus()).isEqualTo(400);
                    assertThat(body.getKind()).isEqualTo("VALIDATION");
                    assertThat(body.getValidationErrors()).containsEntry("name", "must not be blank");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should keep the status and reason of a ResponseStatusException")
    void shouldKeepResponseStatus() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Missing caller identity");

        StepVerifier.create(handler.handleResponseStatusException(ex, exchange))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
                    assertThat(response.getBody().getMessage()).isEqualTo("Missing caller identity");
                    assertThat(response.getBody().getError()).isEqualTo("error.unauthorized");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should answer unexpected errors with a generic 500 body")
    void shouldHandleUnexpectedErrors() {
        StepVerifier.create(handler.handleGenericException(new IllegalStateException("boom"), exchange))
                .assertNext(body -> {
                    assertThat(body.getStatus()).isEqualTo(500);
                    assertThat(body.getMessage()).isEqualTo("error.unexpected_error");
                })
                .verifyComplete();
    }
}
