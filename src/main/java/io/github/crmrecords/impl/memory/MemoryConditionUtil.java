package io.github.crmrecords.impl.memory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import io.github.crmrecords.RecordException;
import io.github.crmrecords.condition.Condition;
import io.github.crmrecords.condition.SimpleExpression;
import io.github.crmrecords.schema.RecordType;

/**
 * A util to apply a {@link Condition} to rows held in memory. A row is a map of "Id" and field values.
 */
public class MemoryConditionUtil {

    MemoryConditionUtil() {
    }

    /**
     * Check that every field used by the condition is "Id" or declared by the record type
     *
     * @param type record type
     * @param cond condition
     * @throws RecordException ValidationError if an undeclared field is used
     */
    public static void checkFields(RecordType type, Condition cond) {
        for (var field : cond.getFieldNames()) {
            if (!RecordType.ID_FIELD.equals(field) && !type.hasField(field)) {
                throw RecordException.validationError(
                        String.format("No such field %s on %s in condition: %s", field, type.getApiName(), cond));
            }
        }
    }

    /**
     * Filter rows by the condition's filter (AND), keeping their order
     *
     * @param rows rows to filter
     * @param cond condition
     * @return rows matching
     */
    public static List<Map<String, Object>> filter(List<Map<String, Object>> rows, Condition cond) {
        var expressions = cond.toExpressions();
        return rows.stream()
                .filter(row -> expressions.stream().allMatch(exp -> exp.test(row)))
                .collect(Collectors.toList());
    }

    /**
     * Apply filter / sort / offset / limit of the condition
     *
     * @param rows rows in insertion order
     * @param cond condition
     * @return result rows
     */
    public static List<Map<String, Object>> apply(List<Map<String, Object>> rows, Condition cond) {

        var ret = new ArrayList<>(filter(rows, cond));

        var comparator = toComparator(cond.sort);
        if (comparator != null) {
            ret.sort(comparator);
        }

        var from = Math.min(cond.offset, ret.size());
        var to = cond.limit < 0 || cond.limit >= ret.size() - from ? ret.size() : from + cond.limit;
        return new ArrayList<>(ret.subList(from, to));
    }

    /**
     * Build a comparator from sort pairs like ["Name", "ASC", "Amount", "DESC"]. null values come first in ASC order.
     *
     * @param sort sort pairs
     * @return comparator, or null if sort is empty
     */
    static Comparator<Map<String, Object>> toComparator(List<String> sort) {

        Comparator<Map<String, Object>> ret = null;

        for (int i = 0; i + 1 < sort.size(); i += 2) {
            var field = sort.get(i);
            var desc = "DESC".equalsIgnoreCase(sort.get(i + 1));

            Comparator<Map<String, Object>> comparator = (r1, r2) -> compareNullFirst(r1.get(field), r2.get(field));
            if (desc) {
                comparator = comparator.reversed();
            }
            ret = ret == null ? comparator : ret.thenComparing(comparator);
        }

        return ret;
    }

    static int compareNullFirst(Object v1, Object v2) {
        if (v1 == null) {
            return v2 == null ? 0 : -1;
        }
        if (v2 == null) {
            return 1;
        }
        return SimpleExpression.compare(v1, v2);
    }
}
