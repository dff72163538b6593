package io.github.crmrecords.util;

import io.github.crmrecords.schema.RecordType;

/**
 * A util class to generate link string for record types and records in order to log their info easier to understand
 */
public class LinkFormatUtil {

    /**
     * Generate the link of a record type. e.g. "/sobjects/Account"
     *
     * @param type record type
     * @return type link
     */
    public static String getTypeLink(RecordType type) {
        return String.format("/sobjects/%s", type.getApiName());
    }

    /**
     * Generate the link of a record. e.g. "/sobjects/Account/001xxxxxxxxxxxxxxx"
     *
     * @param type record type
     * @param id   record id
     * @return record link
     */
    public static String getRecordLink(RecordType type, String id) {
        return String.format("/sobjects/%s/%s", type.getApiName(), id);
    }

}
