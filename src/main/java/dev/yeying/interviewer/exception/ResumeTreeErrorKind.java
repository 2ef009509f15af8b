package dev.yeying.interviewer.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure categories of resume tree operations. Callers branch on the kind, not the message.
 */
public enum ResumeTreeErrorKind {
    VALIDATION(HttpStatus.BAD_REQUEST, "error.validation"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "error.not_found"),
    PERMISSION_DENIED(HttpStatus.FORBIDDEN, "error.permission_denied"),
    DEPTH_LIMIT_EXCEEDED(HttpStatus.CONFLICT, "error.depth_limit_exceeded"),
    NOT_PUBLISHED(HttpStatus.CONFLICT, "error.not_published"),
    STORAGE_FAILURE(HttpStatus.SERVICE_UNAVAILABLE, "error.storage_failure");

    private final HttpStatus status;
    private final String messageKey;

    ResumeTreeErrorKind(HttpStatus status, String messageKey) {
        this.status = status;
        this.messageKey = messageKey;
    }

    public HttpStatus status() {
        return status;
    }

    public String messageKey() {
        return messageKey;
    }
}
