package dev.yeying.interviewer.exception;

public class ValidationException extends ResumeTreeException {

    public ValidationException(String message) {
        super(ResumeTreeErrorKind.VALIDATION, message);
    }
}
