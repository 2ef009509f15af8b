package dev.yeying.interviewer.exception;

/**
 * Base type of every failure signalled by the resume tree operations.
 */
public abstract class ResumeTreeException extends RuntimeException {

    private final ResumeTreeErrorKind kind;

    protected ResumeTreeException(ResumeTreeErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ResumeTreeException(ResumeTreeErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ResumeTreeErrorKind getKind() {
        return kind;
    }
}
