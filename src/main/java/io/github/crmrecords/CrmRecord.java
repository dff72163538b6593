package io.github.crmrecords;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.github.crmrecords.schema.FieldDefinition;
import io.github.crmrecords.schema.RecordType;
import io.github.crmrecords.util.Checker;
import io.github.crmrecords.util.JsonUtil;
import org.apache.commons.lang3.StringUtils;

/**
 * Represent a CRM record (Account / Contact / Opportunity / Lead / Case).
 *
 * <p>
 * A record holds the values of fields declared by its {@link RecordType}, plus a system id which is null until the
 * record is first written. Field names and value types are checked on {@link #put(String, Object)}.
 * </p>
 *
 * <p>
 * A link field (e.g. Contact.AccountId) accepts either an id or another CrmRecord. A record-valued link is resolved to
 * the target's id when written, so that a parent and its child can be created in the same batch.
 * </p>
 *
 * <p>
 * Having toObject and toJson util method to convert to Class or String conveniently.
 * </p>
 */
public class CrmRecord {

    final RecordType type;

    String id;

    RecordState state = RecordState.TRANSIENT;

    final Map<String, Object> fields = new LinkedHashMap<>();

    /**
     * link fields whose value is a record instance, not yet resolved to an id
     */
    final Map<String, CrmRecord> pendingLinks = new LinkedHashMap<>();

    public CrmRecord(RecordType type) {
        this.type = Checker.checkNotNull(type, "type");
    }

    /**
     * Create a transient record with fields
     *
     * @param type   record type
     * @param fields field name to value. may be null
     * @return new record
     * @throws RecordException ValidationError if a field is not declared or a value has a wrong type
     */
    public static CrmRecord of(RecordType type, Map<String, ?> fields) {
        return new CrmRecord(type).putAll(fields);
    }

    /**
     * Restore a persistent record from stored values. Used by {@link RecordStore} implementations.
     *
     * @param type   record type
     * @param id     record id
     * @param fields stored field values (already validated)
     * @return persistent record
     */
    public static CrmRecord restore(RecordType type, String id, Map<String, Object> fields) {
        var record = new CrmRecord(type);
        record.id = Checker.checkNotBlank(id, "id");
        record.state = RecordState.PERSISTENT;
        if (fields != null) {
            record.fields.putAll(fields);
        }
        return record;
    }

    /**
     * Set a field value. null clears the field.
     *
     * @param field field name declared by the record type
     * @param value value. For a link field, an id or a CrmRecord of the target type
     * @return this
     * @throws RecordException ValidationError for unknown field, "Id" field or wrong value type
     */
    public CrmRecord put(String field, Object value) {

        if (StringUtils.equals(field, RecordType.ID_FIELD)) {
            throw RecordException.validationError("Id is assigned by the record store and cannot be set. type:" + type.getApiName());
        }

        var def = type.getField(field);

        if (value instanceof CrmRecord) {
            putLink(def, (CrmRecord) value);
            return this;
        }

        pendingLinks.remove(field);
        fields.put(field, def.getType().convert(field, value));
        return this;
    }

    void putLink(FieldDefinition def, CrmRecord target) {
        if (!def.isLink()) {
            throw RecordException.validationError(String.format("field %s of %s is not a link field", def.getName(), type.getApiName()));
        }
        if (target.type != def.getLinkTarget()) {
            throw RecordException.validationError(String.format("field %s of %s links to %s, provided: %s",
                    def.getName(), type.getApiName(), def.getLinkTarget().getApiName(), target.type.getApiName()));
        }
        if (target.id != null) {
            pendingLinks.remove(def.getName());
            fields.put(def.getName(), target.id);
        } else {
            fields.remove(def.getName());
            pendingLinks.put(def.getName(), target);
        }
    }

    /**
     * Set fields. null map is ignored.
     *
     * @param fields field name to value
     * @return this
     */
    public CrmRecord putAll(Map<String, ?> fields) {
        if (fields == null) {
            return this;
        }
        fields.forEach(this::put);
        return this;
    }

    /**
     * Get a field value. "Id" returns the system id. A pending link returns the target's id (null until written)
     *
     * @param field field name
     * @return value, or null if not set
     */
    public Object get(String field) {
        if (StringUtils.equals(field, RecordType.ID_FIELD)) {
            return id;
        }
        type.getField(field);
        var link = pendingLinks.get(field);
        if (link != null) {
            return link.id;
        }
        return fields.get(field);
    }

    public String getString(String field) {
        var value = get(field);
        return value == null ? null : value.toString();
    }

    public Number getNumber(String field) {
        return (Number) get(field);
    }

    public LocalDate getDate(String field) {
        return (LocalDate) get(field);
    }

    /**
     * Get the record instance set to a link field, if it has not been resolved to an id yet
     *
     * @param field link field name
     * @return linked record or null
     */
    public CrmRecord getLinkedRecord(String field) {
        return pendingLinks.get(field);
    }

    public Map<String, CrmRecord> getPendingLinks() {
        return Collections.unmodifiableMap(pendingLinks);
    }

    /**
     * Whether the field has a value (or a pending link)
     *
     * @param field field name
     * @return true if set
     */
    public boolean has(String field) {
        return fields.get(field) != null || pendingLinks.containsKey(field);
    }

    /**
     * Get the value of the type's natural key. e.g. Account.Name
     *
     * @return natural key value
     */
    public String getNaturalKeyValue() {
        return getString(type.getNaturalKey());
    }

    /**
     * Get the field values set on this record (pending links excluded)
     *
     * @return unmodifiable view of fields
     */
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public RecordType getType() {
        return type;
    }

    public String getId() {
        return id;
    }

    public RecordState getState() {
        return state;
    }

    public boolean isTransient() {
        return state == RecordState.TRANSIENT;
    }

    public boolean isPersistent() {
        return state == RecordState.PERSISTENT;
    }

    public boolean isDeleted() {
        return state == RecordState.DELETED;
    }

    /**
     * Replace pending links by the ids of their targets. Used by {@link RecordStore} implementations when writing.
     *
     * @throws RecordException ValidationError if a linked record has no id
     */
    public void resolveLinks() {
        for (var entry : pendingLinks.entrySet()) {
            var target = entry.getValue();
            if (target.id == null) {
                throw RecordException.validationError(String.format("field %s of %s links to a %s which is not written",
                        entry.getKey(), type.getApiName(), target.type.getApiName()));
            }
            fields.put(entry.getKey(), target.id);
        }
        pendingLinks.clear();
    }

    /**
     * Mark this record as written with the id. Used by {@link RecordStore} implementations.
     *
     * @param id id assigned by the store
     * @throws IllegalStateException if the record already has a different id
     */
    public void markPersistent(String id) {
        Checker.checkNotBlank(id, "id");
        if (this.id != null && !this.id.equals(id)) {
            throw new IllegalStateException(String.format("id of a record cannot change. current:%s, new:%s", this.id, id));
        }
        this.id = id;
        this.state = RecordState.PERSISTENT;
    }

    /**
     * Mark this record as deleted. Used by {@link RecordStore} implementations.
     */
    public void markDeleted() {
        this.state = RecordState.DELETED;
    }

    /**
     * Convert to a map including "Id" (if assigned) and all fields
     *
     * @return map
     */
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        if (id != null) {
            map.put(RecordType.ID_FIELD, id);
        }
        map.putAll(fields);
        pendingLinks.forEach((field, target) -> map.put(field, target.id));
        return map;
    }

    public <T> T toObject(Class<T> classOfT) {
        return JsonUtil.fromMap(toMap(), classOfT);
    }

    public String toJson() {
        return JsonUtil.toJson(toMap());
    }

    @Override
    public String toString() {
        return type.getApiName() + JsonUtil.toJsonNoIndent(toMap()) + "(" + state + ")";
    }
}
