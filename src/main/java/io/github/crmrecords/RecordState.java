package io.github.crmrecords;

/**
 * Lifecycle state of a {@link CrmRecord}: TRANSIENT -> PERSISTENT -> DELETED
 */
public enum RecordState {

    /**
     * Not written yet. id is null.
     */
    TRANSIENT,

    /**
     * Written to the store. id is assigned and never changes.
     */
    PERSISTENT,

    /**
     * Removed from the store. The instance is a dangling handle.
     */
    DELETED
}
