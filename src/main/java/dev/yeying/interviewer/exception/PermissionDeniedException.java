package dev.yeying.interviewer.exception;

public class PermissionDeniedException extends ResumeTreeException {

    public PermissionDeniedException(String resourceDescriptor) {
        super(ResumeTreeErrorKind.PERMISSION_DENIED, "Caller does not own " + resourceDescriptor);
    }
}
