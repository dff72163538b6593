package io.github.crmrecords.util;

import io.github.crmrecords.schema.RecordType;
import org.apache.commons.lang3.RandomStringUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * A util to generate and check record ids.
 *
 * <p>
 * An id is 18 characters long: the 3-character key prefix of its record type followed by 15 alphanumeric characters.
 * e.g. "001" + "Ab3dE5fG7hI9jK1" for an Account.
 * </p>
 */
public class IdUtil {

    public static final int ID_LENGTH = 18;

    IdUtil() {
    }

    /**
     * Generate a new id for the record type
     *
     * @param type record type
     * @return new id
     */
    public static String generateId(RecordType type) {
        Checker.checkNotNull(type, "type");
        return type.getKeyPrefix() + RandomStringUtils.randomAlphanumeric(ID_LENGTH - type.getKeyPrefix().length());
    }

    /**
     * Whether the id is well-formed and belongs to the record type
     *
     * @param type record type
     * @param id   id to check
     * @return true if the id has the type's key prefix and the correct length
     */
    public static boolean isIdOf(RecordType type, String id) {
        return type != null
                && StringUtils.length(id) == ID_LENGTH
                && StringUtils.isAlphanumeric(id)
                && id.startsWith(type.getKeyPrefix());
    }

    /**
     * Find the record type of the id by its key prefix
     *
     * @param id record id
     * @return record type, or null if no type matches
     */
    public static RecordType typeOf(String id) {
        if (StringUtils.length(id) != ID_LENGTH) {
            return null;
        }
        for (var type : RecordType.values()) {
            if (id.startsWith(type.getKeyPrefix())) {
                return type;
            }
        }
        return null;
    }
}
