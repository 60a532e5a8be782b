package dev.pagestack.entity;

/**
 * Entities with pre-assigned Snowflake ids that track whether they still need an INSERT.
 * Reset after load by {@link dev.pagestack.config.PersistableEntityCallback}.
 */
public interface NewRecordAware {
    void setNewRecord(boolean newRecord);
}
