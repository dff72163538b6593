package io.github.crmrecords;

/**
 * Mode of {@link RecordStore#write}
 */
public enum WriteMode {
    CREATE, UPDATE, UPSERT
}
