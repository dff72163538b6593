package io.github.crmrecords;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import io.github.crmrecords.condition.Condition;
import io.github.crmrecords.schema.RecordType;
import io.github.crmrecords.util.Checker;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helper to create or update records of one type by their natural key (e.g. Account.Name, Contact.LastName).
 *
 * <pre>
 * var helper = new RecordUpsertHelper(store, RecordType.ACCOUNT);
 * var ibm = helper.findOrCreate("IBM", Map.of("NumberOfEmployees", 282200));
 * var contacts = new RecordUpsertHelper(store, RecordType.CONTACT)
 *         .batchUpsertByName(List.of("Doe", "Jane"), name -> Map.of("Title", "Engineer"));
 * </pre>
 *
 * <p>
 * When more than one record has the same natural key, the first one returned by the store is used.
 * The store does not guarantee which one that is.
 * </p>
 */
public class RecordUpsertHelper {

    private static Logger log = LoggerFactory.getLogger(RecordUpsertHelper.class);

    final RecordStore store;

    final RecordType type;

    public RecordUpsertHelper(RecordStore store, RecordType type) {
        this.store = Checker.checkNotNull(store, "store");
        this.type = Checker.checkNotNull(type, "type");
    }

    /**
     * Find records whose natural key equals the value
     *
     * @param naturalKeyValue natural key value
     * @return records found, may be empty
     */
    public List<CrmRecord> findByName(String naturalKeyValue) {
        checkNaturalKey(naturalKeyValue);
        return store.query(type, Condition.filter(type.getNaturalKey(), naturalKeyValue));
    }

    /**
     * Find a record by natural key and update it, or create a new one with the default fields.
     * An existing record is written back without changes.
     *
     * @param naturalKeyValue natural key value. must not be empty
     * @param defaultFields   fields of a new record
     * @return the record written, with id assigned
     * @throws RecordException ValidationError if the natural key is empty or a field is invalid
     */
    public CrmRecord findOrCreate(String naturalKeyValue, Map<String, ?> defaultFields) {
        return findOrCreate(naturalKeyValue, defaultFields, Map.of());
    }

    /**
     * Find a record by natural key and apply the update fields to it, or create a new one with the default fields.
     * Exactly one write (create or update) is issued.
     *
     * @param naturalKeyValue natural key value. must not be empty
     * @param defaultFields   fields of a new record
     * @param updateFields    fields applied to an existing record
     * @return the record written, with id assigned
     * @throws RecordException ValidationError if the natural key is empty or a field is invalid
     */
    public CrmRecord findOrCreate(String naturalKeyValue, Map<String, ?> defaultFields, Map<String, ?> updateFields) {

        var existing = findByName(naturalKeyValue);

        if (!existing.isEmpty()) {
            var record = existing.get(0);
            log.debug("found {} {}={}, id:{}, duplicates:{}", type.getApiName(), type.getNaturalKey(), naturalKeyValue,
                    record.getId(), existing.size() - 1);
            applyFields(record, naturalKeyValue, updateFields);
            return store.update(record);
        }

        log.debug("no {} {}={} found, creating", type.getApiName(), type.getNaturalKey(), naturalKeyValue);
        var record = newRecord(naturalKeyValue, defaultFields);
        return store.create(record);
    }

    /**
     * Create or update records by natural keys, in one query and one batch write.
     *
     * <p>
     * For each key, an existing record is updated by the fields from fieldsFactory, otherwise a new record is created
     * with them. The result has the same size and order as the input. A repeated key resolves to the same record
     * instance.
     * </p>
     *
     * @param naturalKeyValues natural key values, duplicates allowed
     * @param fieldsFactory    produce the fields of a record from its key. called once per distinct key
     * @return records in input order
     * @throws RecordException ValidationError if any key is empty. No query or write is done in that case
     */
    public List<CrmRecord> batchUpsertByName(List<String> naturalKeyValues, Function<String, ? extends Map<String, ?>> fieldsFactory) {

        Checker.checkNotNull(naturalKeyValues, "naturalKeyValues");
        Checker.checkNotNull(fieldsFactory, "fieldsFactory");

        if (naturalKeyValues.isEmpty()) {
            return new ArrayList<>();
        }

        naturalKeyValues.forEach(this::checkNaturalKey);

        var distinctKeys = Lists.newArrayList(new LinkedHashSet<>(naturalKeyValues));
        var found = store.query(type, Condition.filter(type.getNaturalKey() + " IN", distinctKeys));

        Map<String, CrmRecord> existing = Maps.newLinkedHashMap();
        for (var record : found) {
            existing.putIfAbsent(record.getNaturalKeyValue(), record);
        }

        Map<String, CrmRecord> resolved = Maps.newLinkedHashMap();
        var ret = new ArrayList<CrmRecord>(naturalKeyValues.size());

        for (var key : naturalKeyValues) {
            var record = resolved.get(key);
            if (record == null) {
                var fields = fieldsFactory.apply(key);
                record = existing.get(key);
                if (record != null) {
                    applyFields(record, key, fields);
                } else {
                    record = newRecord(key, fields);
                }
                resolved.put(key, record);
            }
            ret.add(record);
        }

        log.debug("upsert {} by {}: input:{}, distinct:{}, existing:{}", type.getApiName(), type.getNaturalKey(),
                naturalKeyValues.size(), resolved.size(), existing.size());

        store.write(new ArrayList<>(resolved.values()), WriteMode.UPSERT);

        return ret;
    }

    /**
     * Delete records in one batch. An empty list does nothing.
     *
     * @param records persisted records
     * @throws RecordException NotFound if any record was never written or has been deleted. Nothing is deleted then
     */
    public void deleteAll(List<CrmRecord> records) {
        Checker.checkNotNull(records, "records");

        if (CollectionUtils.isEmpty(records)) {
            return;
        }

        store.delete(records);
    }

    CrmRecord newRecord(String naturalKeyValue, Map<String, ?> fields) {
        return applyFields(new CrmRecord(type), naturalKeyValue, fields);
    }

    /**
     * Put the fields, then the natural key, so that the fields cannot change the key the record was looked up by
     */
    CrmRecord applyFields(CrmRecord record, String naturalKeyValue, Map<String, ?> fields) {
        return record.putAll(fields).put(type.getNaturalKey(), naturalKeyValue);
    }

    void checkNaturalKey(String naturalKeyValue) {
        if (StringUtils.isBlank(naturalKeyValue)) {
            throw RecordException.validationError(String.format("%s: %s.%s should be non-empty, provided: '%s'",
                    RecordException.VALIDATION_ERROR, type.getApiName(), type.getNaturalKey(), naturalKeyValue));
        }
    }

    public RecordType getType() {
        return type;
    }
}
