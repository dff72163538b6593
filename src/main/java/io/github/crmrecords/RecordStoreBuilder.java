package io.github.crmrecords;

import io.github.crmrecords.impl.memory.InMemoryRecordStore;
import io.github.crmrecords.util.Checker;
import io.github.crmrecords.util.EnvUtil;
import org.apache.commons.lang3.StringUtils;

/**
 * Builder class to build a record store instance
 *
 * <p>
 * Settings not specified explicitly are read from environment variables (or a .env file):
 * </p>
 * <pre>
 *     CRM_MAX_BATCH_SIZE=-1
 *     CRM_LINK_CHECK_ENABLED=true
 * </pre>
 */
public class RecordStoreBuilder {

    /**
     * Constant for storeType: memory
     */
    public static final String MEMORY = InMemoryRecordStore.STORE_TYPE;

    public static final String ENV_MAX_BATCH_SIZE = "CRM_MAX_BATCH_SIZE";

    public static final String ENV_LINK_CHECK_ENABLED = "CRM_LINK_CHECK_ENABLED";

    String storeType = MEMORY;

    String storeName = "default";

    int maxBatchSize = EnvUtil.getIntOrDefault(ENV_MAX_BATCH_SIZE, InMemoryRecordStore.DEFAULT_MAX_BATCH_SIZE);

    boolean linkCheckEnabled = EnvUtil.getBooleanOrDefault(ENV_LINK_CHECK_ENABLED, true);

    /**
     * Specify the storeType. only "memory" is supported at present
     *
     * @param storeType
     * @return recordStoreBuilder
     */
    public RecordStoreBuilder withStoreType(String storeType) {
        this.storeType = storeType;
        return this;
    }

    /**
     * Specify the store name, which is used in logs
     *
     * @param storeName
     * @return recordStoreBuilder
     */
    public RecordStoreBuilder withStoreName(String storeName) {
        this.storeName = storeName;
        return this;
    }

    /**
     * Specify the max number of records in one batch write / delete. default to -1(unlimited)
     *
     * @param maxBatchSize
     * @return recordStoreBuilder
     */
    public RecordStoreBuilder withMaxBatchSize(int maxBatchSize) {
        this.maxBatchSize = maxBatchSize;
        return this;
    }

    /**
     * Specify whether a link field must reference an existing record when written. default to true
     *
     * <p>
     * If disabled, only the id format and its record type are checked.
     * </p>
     *
     * @param enabled
     * @return recordStoreBuilder
     */
    public RecordStoreBuilder withLinkCheckEnabled(boolean enabled) {
        this.linkCheckEnabled = enabled;
        return this;
    }

    /**
     * Build the record store instance.
     *
     * @return RecordStore instance
     */
    public RecordStore build() {
        Checker.checkNotBlank(storeType, "storeType");
        Checker.checkNotBlank(storeName, "storeName");

        if (StringUtils.equals(storeType, MEMORY)) {
            return new InMemoryRecordStore(storeName, maxBatchSize, linkCheckEnabled);
        }

        throw new IllegalArgumentException("Not supported storeType: " + storeType);
    }
}
