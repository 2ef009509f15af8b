package dev.yeying.interviewer.exception;

/**
 * The referenced resume version or room does not exist, or the version has been deleted.
 */
public class ResourceNotFoundException extends ResumeTreeException {

    public ResourceNotFoundException(String resourceType, Object id) {
        super(ResumeTreeErrorKind.NOT_FOUND, resourceType + " not found: " + id);
    }
}
