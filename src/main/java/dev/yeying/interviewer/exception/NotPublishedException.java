package dev.yeying.interviewer.exception;

public class NotPublishedException extends ResumeTreeException {

    public NotPublishedException(Long resumeId) {
        super(ResumeTreeErrorKind.NOT_PUBLISHED, "Resume " + resumeId + " must be published first");
    }
}
