package io.github.crmrecords.impl.memory;

import java.util.*;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import io.github.crmrecords.CrmRecord;
import io.github.crmrecords.RecordException;
import io.github.crmrecords.RecordStore;
import io.github.crmrecords.WriteMode;
import io.github.crmrecords.condition.Condition;
import io.github.crmrecords.schema.FieldDefinition;
import io.github.crmrecords.schema.RecordType;
import io.github.crmrecords.util.Checker;
import io.github.crmrecords.util.IdUtil;
import io.github.crmrecords.util.LinkFormatUtil;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A record store holding records in memory.
 *
 * <p>
 * Can do CRUD and query of records. Each batch is validated completely before anything is applied, so a failing batch
 * leaves the store unchanged. Ids of deleted records are remembered, so a later write to a deleted record fails with
 * StaleReference instead of silently recreating it.
 * </p>
 */
public class InMemoryRecordStore implements RecordStore {

    private static Logger log = LoggerFactory.getLogger(InMemoryRecordStore.class);

    public static final String STORE_TYPE = "memory";

    /**
     * maxBatchSize meaning no limit on the number of records in a batch
     */
    public static final int UNLIMITED = -1;

    public static final int DEFAULT_MAX_BATCH_SIZE = UNLIMITED;

    final String storeName;

    final int maxBatchSize;

    final boolean linkCheckEnabled;

    /**
     * record type -> (id -> stored fields), in insertion order
     */
    final Map<RecordType, LinkedHashMap<String, Map<String, Object>>> tables = new EnumMap<>(RecordType.class);

    final Set<String> deletedIds = new HashSet<>();

    public InMemoryRecordStore() {
        this("default", DEFAULT_MAX_BATCH_SIZE, true);
    }

    public InMemoryRecordStore(String storeName, int maxBatchSize, boolean linkCheckEnabled) {
        Checker.checkNotBlank(storeName, "storeName");
        Checker.check(maxBatchSize > 0 || maxBatchSize == UNLIMITED,
                "maxBatchSize should be > 0 or -1(unlimited), provided: " + maxBatchSize);

        this.storeName = storeName;
        this.maxBatchSize = maxBatchSize;
        this.linkCheckEnabled = linkCheckEnabled;

        for (var type : RecordType.values()) {
            tables.put(type, new LinkedHashMap<>());
        }
    }

    @Override
    public synchronized List<CrmRecord> query(RecordType type, Condition cond) {

        Checker.checkNotNull(type, "type");
        var condition = cond == null ? new Condition() : cond;

        return execute(() -> {
            MemoryConditionUtil.checkFields(type, condition);

            var rows = MemoryConditionUtil.apply(toRows(type), condition);

            log.debug("queried Records:{}, cond:{}, count:{}, store:{}", LinkFormatUtil.getTypeLink(type), condition, rows.size(), storeName);

            return rows.stream().map(row -> toRecord(type, row)).collect(Collectors.toList());
        });
    }

    @Override
    public synchronized int count(RecordType type, Condition cond) {

        Checker.checkNotNull(type, "type");
        var condition = cond == null ? new Condition() : cond;

        return execute(() -> {
            MemoryConditionUtil.checkFields(type, condition);
            return MemoryConditionUtil.filter(toRows(type), condition).size();
        });
    }

    @Override
    public synchronized CrmRecord read(RecordType type, String id) {

        Checker.checkNotNull(type, "type");
        Checker.checkNotBlank(id, "id");

        var link = LinkFormatUtil.getRecordLink(type, id);
        var stored = tables.get(type).get(id);
        if (stored == null) {
            throw RecordException.notFound(String.format("%s: Resource Not Found. %s, store:%s",
                    RecordException.NOT_FOUND, link, storeName));
        }

        log.info("read Record:{}, store:{}", link, storeName);

        return CrmRecord.restore(type, id, new LinkedHashMap<>(stored));
    }

    @Override
    public synchronized List<CrmRecord> write(List<CrmRecord> records, WriteMode mode) {

        Checker.checkNotNull(mode, "mode");
        Checker.checkNoNullElement(records, "records");

        if (CollectionUtils.isEmpty(records)) {
            return new ArrayList<>();
        }

        return execute(() -> {
            var distinct = distinct(records);
            checkBatchSize(distinct);

            // validate everything first. nothing is changed if any record is invalid
            var creates = new LinkedHashSet<CrmRecord>();
            for (var record : distinct) {
                if (isCreate(record, mode)) {
                    creates.add(record);
                }
            }
            for (var record : distinct) {
                checkWritable(record, mode, creates.contains(record));
                checkLinks(record, distinct);
            }

            // apply
            for (var record : creates) {
                record.markPersistent(generateId(record.getType()));
            }

            for (var record : distinct) {
                record.resolveLinks();
                var table = tables.get(record.getType());
                var link = LinkFormatUtil.getRecordLink(record.getType(), record.getId());

                if (creates.contains(record)) {
                    table.put(record.getId(), new LinkedHashMap<>(record.getFields()));
                    log.info("created Record:{}, store:{}", link, storeName);
                } else {
                    table.get(record.getId()).putAll(record.getFields());
                    record.markPersistent(record.getId());
                    log.info("updated Record:{}, store:{}", link, storeName);
                }
            }

            return new ArrayList<>(records);
        });
    }

    @Override
    public synchronized void delete(List<CrmRecord> records) {

        Checker.checkNoNullElement(records, "records");

        if (CollectionUtils.isEmpty(records)) {
            return;
        }

        execute(() -> {
            var distinct = distinct(records);
            checkBatchSize(distinct);

            var ids = new LinkedHashMap<String, RecordType>();
            for (var record : distinct) {
                var id = record.getId();
                if (id == null) {
                    throw RecordException.notFound(String.format("%s: %s has never been written and cannot be deleted. record:%s",
                            RecordException.NOT_FOUND, record.getType().getApiName(), record));
                }
                if (record.isDeleted() || deletedIds.contains(id)) {
                    throw RecordException.notFound(String.format("%s: %s has already been deleted",
                            RecordException.NOT_FOUND, LinkFormatUtil.getRecordLink(record.getType(), id)));
                }
                if (!tables.get(record.getType()).containsKey(id)) {
                    throw RecordException.notFound(String.format("%s: Resource Not Found. %s, store:%s",
                            RecordException.NOT_FOUND, LinkFormatUtil.getRecordLink(record.getType(), id), storeName));
                }
                ids.put(id, record.getType());
            }

            ids.forEach((id, type) -> {
                tables.get(type).remove(id);
                deletedIds.add(id);
                log.info("deleted Record:{}, store:{}", LinkFormatUtil.getRecordLink(type, id), storeName);
            });
            distinct.forEach(CrmRecord::markDeleted);

            return null;
        });
    }

    static boolean isCreate(CrmRecord record, WriteMode mode) {
        return mode == WriteMode.CREATE || (mode == WriteMode.UPSERT && record.getId() == null);
    }

    /**
     * Check the record can be written by the mode
     *
     * @param record record
     * @param mode   write mode
     * @param create whether the record is going to be created
     */
    void checkWritable(CrmRecord record, WriteMode mode, boolean create) {

        var type = record.getType();
        var id = record.getId();

        if (record.isDeleted() || (id != null && deletedIds.contains(id))) {
            throw RecordException.staleReference(String.format("%s: %s has been deleted and cannot be written",
                    RecordException.STALE_REFERENCE, LinkFormatUtil.getRecordLink(type, id)));
        }

        if (create) {
            if (id != null) {
                throw RecordException.validationError(String.format("%s: cannot specify Id in a create. %s",
                        RecordException.VALIDATION_ERROR, LinkFormatUtil.getRecordLink(type, id)));
            }
            checkRequiredFields(type, record.getFields(), record);
            return;
        }

        if (id == null) {
            throw RecordException.notFound(String.format("%s: %s has never been written and cannot be updated(mode:%s). record:%s",
                    RecordException.NOT_FOUND, type.getApiName(), mode, record));
        }

        var stored = tables.get(type).get(id);
        if (stored == null) {
            throw RecordException.notFound(String.format("%s: Resource Not Found. %s, store:%s",
                    RecordException.NOT_FOUND, LinkFormatUtil.getRecordLink(type, id), storeName));
        }

        var merged = new LinkedHashMap<>(stored);
        merged.putAll(record.getFields());
        checkRequiredFields(type, merged, record);
    }

    static void checkRequiredFields(RecordType type, Map<String, Object> fields, CrmRecord record) {
        var missing = type.getRequiredFields().stream()
                .map(FieldDefinition::getName)
                .filter(name -> !record.getPendingLinks().containsKey(name))
                .filter(name -> {
                    var value = fields.get(name);
                    return value == null || (value instanceof String && StringUtils.isBlank((String) value));
                })
                .collect(Collectors.toList());

        if (!missing.isEmpty()) {
            throw RecordException.validationError(String.format("%s: Required fields are missing: %s. type:%s",
                    RecordException.VALIDATION_ERROR, missing, type.getApiName()));
        }
    }

    /**
     * Check every link of the record references an existing record of the target type,
     * or a record written in the same batch
     *
     * @param record record to check
     * @param batch  records written in the same batch
     */
    void checkLinks(CrmRecord record, Collection<CrmRecord> batch) {

        var type = record.getType();

        for (var entry : record.getPendingLinks().entrySet()) {
            var target = entry.getValue();
            if (target.isDeleted() || (target.getId() != null && deletedIds.contains(target.getId()))) {
                throw RecordException.validationError(String.format("%s: field %s of %s links to a deleted %s",
                        RecordException.VALIDATION_ERROR, entry.getKey(), type.getApiName(), target.getType().getApiName()));
            }
            if (target.getId() == null && !batch.contains(target)) {
                throw RecordException.validationError(String.format(
                        "%s: field %s of %s links to a %s which is neither written nor in the same batch",
                        RecordException.VALIDATION_ERROR, entry.getKey(), type.getApiName(), target.getType().getApiName()));
            }
            if (target.getId() != null) {
                checkLinkedId(type, type.getField(entry.getKey()), target.getId());
            }
        }

        var stored = record.getId() == null ? null : tables.get(type).get(record.getId());

        for (var def : type.getLinkFields()) {
            var value = record.getFields().get(def.getName());
            if (value == null) {
                continue;
            }
            if (stored != null && value.equals(stored.get(def.getName()))) {
                // unchanged link
                continue;
            }
            checkLinkedId(type, def, value.toString());
        }
    }

    void checkLinkedId(RecordType type, FieldDefinition def, String targetId) {
        var targetType = def.getLinkTarget();
        if (!IdUtil.isIdOf(targetType, targetId)) {
            throw RecordException.validationError(String.format("%s: field %s of %s links to %s, provided id: %s",
                    RecordException.VALIDATION_ERROR, def.getName(), type.getApiName(), targetType.getApiName(), targetId));
        }
        if (linkCheckEnabled && !tables.get(targetType).containsKey(targetId)) {
            throw RecordException.validationError(String.format("%s: field %s of %s links to a record which does not exist: %s",
                    RecordException.VALIDATION_ERROR, def.getName(), type.getApiName(),
                    LinkFormatUtil.getRecordLink(targetType, targetId)));
        }
    }

    void checkBatchSize(Collection<CrmRecord> records) {
        if (maxBatchSize != UNLIMITED && records.size() > maxBatchSize) {
            throw RecordException.validationError(String.format("%s: The number of records in a batch should not exceed %d, provided: %d",
                    RecordException.VALIDATION_ERROR, maxBatchSize, records.size()));
        }
    }

    String generateId(RecordType type) {
        var table = tables.get(type);
        String id;
        do {
            id = IdUtil.generateId(type);
        } while (table.containsKey(id) || deletedIds.contains(id));
        return id;
    }

    /**
     * distinct records by instance, keeping order
     */
    static List<CrmRecord> distinct(List<CrmRecord> records) {
        var seen = Collections.newSetFromMap(new IdentityHashMap<CrmRecord, Boolean>());
        return records.stream().filter(seen::add).collect(Collectors.toList());
    }

    List<Map<String, Object>> toRows(RecordType type) {
        return tables.get(type).entrySet().stream().map(entry -> {
            var row = new LinkedHashMap<String, Object>();
            row.put(RecordType.ID_FIELD, entry.getKey());
            row.putAll(entry.getValue());
            return (Map<String, Object>) row;
        }).collect(Collectors.toList());
    }

    static CrmRecord toRecord(RecordType type, Map<String, Object> row) {
        var fields = new LinkedHashMap<>(row);
        var id = fields.remove(RecordType.ID_FIELD).toString();
        return CrmRecord.restore(type, id, fields);
    }

    /**
     * Run an operation. RecordException and IllegalArgumentException are thrown as they are,
     * any other failure is wrapped as BackingStoreError.
     */
    <T> T execute(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (RecordException | IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("record store failure. store:{}", storeName, e);
            throw RecordException.backingStoreError(e);
        }
    }

    @Override
    public String getStoreType() {
        return STORE_TYPE;
    }

    @Override
    public String getStoreName() {
        return storeName;
    }
}
