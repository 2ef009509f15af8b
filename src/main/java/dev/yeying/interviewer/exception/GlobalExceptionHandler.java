package dev.yeying.interviewer.exception;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final MessageSource messageSource;

    @ExceptionHandler(ResumeTreeException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResumeTreeException(ResumeTreeException ex,
                                                                         ServerWebExchange exchange) {
        ResumeTreeErrorKind kind = ex.getKind();
        if (kind == ResumeTreeErrorKind.STORAGE_FAILURE) {
            log.error("Storage failure on {}: {}", exchange.getRequest().getPath().value(), ex.getMessage(), ex);
        } else {
            log.warn("{} on {}: {}", kind, exchange.getRequest().getPath().value(), ex.getMessage());
        }
        Locale locale = resolveLocale(exchange);
        // storage details stay in the log
        String message = kind == ResumeTreeErrorKind.STORAGE_FAILURE
                ? msg(locale, "error.storage_unavailable")
                : ex.getMessage();
        return Mono.just(ResponseEntity.status(kind.status()).body(ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(kind.status().value())
                .error(msg(locale, kind.messageKey()))
                .kind(kind.name())
                .message(message)
                .path(exchange.getRequest().getPath().value())
                .build()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleValidationErrors(WebExchangeBindException ex, ServerWebExchange exchange) {
        Locale locale = resolveLocale(exchange);
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(
                        FieldError::getField,
                        fieldError -> fieldError.getDefaultMessage() != null
                                ? fieldError.getDefaultMessage()
                                : msg(locale, "error.invalid_value"),
                        (existing, ignored) -> existing));
        log.warn("Request validation failed: {}", errors);
        return Mono.just(ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error(msg(locale, "error.validation"))
                .kind(ResumeTreeErrorKind.VALIDATION.name())
                .message(msg(locale, "error.invalid_request_data"))
                .path(exchange.getRequest().getPath().value())
                .validationErrors(errors)
                .build());
    }

    @ExceptionHandler(ServerWebInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleInputException(ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("Malformed request on {}: {}", exchange.getRequest().getPath().value(), ex.getReason());
        Locale locale = resolveLocale(exchange);
        return Mono.just(ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error(msg(locale, "error.bad_request"))
                .message(msg(locale, "error.malformed_request"))
                .path(exchange.getRequest().getPath().value())
                .build());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatusException(ResponseStatusException ex,
                                                                             ServerWebExchange exchange) {
        HttpStatusCode status = ex.getStatusCode();
        Locale locale = resolveLocale(exchange);
        return Mono.just(ResponseEntity.status(status).body(ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(msg(locale, statusToKey(status)))
                .message(ex.getReason() != null ? ex.getReason() : msg(locale, statusToKey(status)))
                .path(exchange.getRequest().getPath().value())
                .build()));
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Mono<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error on {}", exchange.getRequest().getPath().value(), ex);
        Locale locale = resolveLocale(exchange);
        return Mono.just(ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .error(msg(locale, "error.internal_server_error"))
                .message(msg(locale, "error.unexpected_error"))
                .path(exchange.getRequest().getPath().value())
                .build());
    }

    private Locale resolveLocale(ServerWebExchange exchange) {
        Locale locale = exchange.getLocaleContext().getLocale();
        return locale != null ? locale : Locale.ENGLISH;
    }

    private String msg(Locale locale, String code, Object... args) {
        return messageSource.getMessage(code, args, code, locale);
    }

    private String statusToKey(HttpStatusCode status) {
        return switch (status.value()) {
            case 400 -> "error.bad_request";
            case 401 -> "error.unauthorized";
            case 403 -> "error.permission_denied";
            case 404 -> "error.not_found";
            case 409 -> "error.conflict";
            default -> "error.internal_server_error";
        };
    }
}
