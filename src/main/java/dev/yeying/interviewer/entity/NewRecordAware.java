package dev.yeying.interviewer.entity;

/**
 * Entities with pre-assigned ids that track whether they still need an INSERT.
 * See {@link dev.yeying.interviewer.config.PersistableEntityCallback}.
 */
public interface NewRecordAware {
    void setNewRecord(boolean newRecord);
}
