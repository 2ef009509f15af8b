package dev.yeying.interviewer.entity;

/**
 * Lifecycle state of a resume node.
 * Stored as its lower-case {@link #value()} in the {@code status} column.
 */
public enum ResumeNodeStatus {
    DRAFT("draft"),
    PUBLISHED("published"),
    DELETED("deleted");

    private final String value;

    ResumeNodeStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean matches(String status) {
        return value.equals(status);
    }

    public static ResumeNodeStatus fromValue(String status) {
        for (ResumeNodeStatus candidate : values()) {
            if (candidate.matches(status)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown resume status: " + status);
    }
}
