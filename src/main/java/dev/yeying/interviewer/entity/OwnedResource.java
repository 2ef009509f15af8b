package dev.yeying.interviewer.entity;

/**
 * A resource whose mutations are restricted to a single owning identity.
 */
public interface OwnedResource {

    /**
     * Identity of the owner, or {@code null} when the resource has none.
     */
    String getOwnerIdentity();

    /**
     * Short description used in log lines and error messages, e.g. {@code resume 123}.
     */
    String resourceDescriptor();
}
