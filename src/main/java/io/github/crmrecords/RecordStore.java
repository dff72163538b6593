package io.github.crmrecords;

import java.util.Collections;
import java.util.List;

import io.github.crmrecords.condition.Condition;
import io.github.crmrecords.schema.RecordType;

/**
 * Interface representing a record store (the backing store of CRM records).
 *
 * <p>
 * Can do CRUD and query of records. Batch writes are all-or-nothing: a failure on any record fails the whole batch
 * and nothing is applied.
 * </p>
 *
 * <pre>
 * Usage:
 * var store = new RecordStoreBuilder().withStoreType("memory").build();
 * var account = store.create(CrmRecord.of(RecordType.ACCOUNT, Map.of("Name", "IBM")));
 * var found = store.query(RecordType.ACCOUNT, Condition.filter("Name", "IBM"));
 * </pre>
 */
public interface RecordStore {

    /**
     * Query records of a type
     *
     * @param type record type
     * @param cond filter / sort / offset / limit. null means all records
     * @return new persistent record instances matching the condition
     * @throws RecordException ValidationError if the condition refers to an undeclared field
     */
    List<CrmRecord> query(RecordType type, Condition cond);

    /**
     * Count records of a type
     *
     * @param type record type
     * @param cond filter. sort / offset / limit are ignored
     * @return number of records matching the condition
     */
    int count(RecordType type, Condition cond);

    /**
     * Read a record by id
     *
     * @param type record type
     * @param id   record id
     * @return record instance
     * @throws RecordException NotFound if the record does not exist or has been deleted
     */
    CrmRecord read(RecordType type, String id);

    /**
     * Write records in a single batch.
     *
     * @param records records to write. a record appearing more than once is written once
     * @param mode    CREATE / UPDATE / UPSERT
     * @return the same record instances, with ids assigned and state PERSISTENT
     * @throws RecordException ValidationError / NotFound / StaleReference. nothing is applied on failure
     */
    List<CrmRecord> write(List<CrmRecord> records, WriteMode mode);

    /**
     * Delete records in a single batch.
     *
     * @param records persisted records to delete
     * @throws RecordException NotFound if any record has no id, or does not exist, or has been deleted.
     *                         nothing is deleted on failure
     */
    void delete(List<CrmRecord> records);

    /**
     * Create a record
     *
     * @param record transient record
     * @return the record with id assigned
     */
    default CrmRecord create(CrmRecord record) {
        return write(Collections.singletonList(record), WriteMode.CREATE).get(0);
    }

    /**
     * Update a record
     *
     * @param record persisted record
     * @return the record
     */
    default CrmRecord update(CrmRecord record) {
        return write(Collections.singletonList(record), WriteMode.UPDATE).get(0);
    }

    /**
     * Create the record if it has no id, or update it
     *
     * @param record record
     * @return the record with id assigned
     */
    default CrmRecord upsert(CrmRecord record) {
        return write(Collections.singletonList(record), WriteMode.UPSERT).get(0);
    }

    /**
     * Delete a record
     *
     * @param record persisted record
     */
    default void delete(CrmRecord record) {
        delete(Collections.singletonList(record));
    }

    /**
     * Get the store type. e.g. "memory"
     *
     * @return store type
     */
    String getStoreType();

    /**
     * Get the store name used in logs
     *
     * @return store name
     */
    String getStoreName();
}
