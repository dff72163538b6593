package io.github.crmrecords.condition;

import java.util.Map;

public interface Expression {

    /**
     * Whether the field map of a record satisfies this expression
     *
     * @param fields field name to value. "Id" is included for persisted records
     * @return true if satisfied
     */
    public boolean test(Map<String, Object> fields);

}
