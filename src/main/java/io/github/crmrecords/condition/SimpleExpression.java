package io.github.crmrecords.condition;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

import io.github.crmrecords.util.NumberUtil;
import org.apache.commons.lang3.StringUtils;

/**
 * A class representing simple expression
 * <p>
 * {@code
 * Name = "IBM", Amount > 1000, LastName IN ["Doe", "Jane"], Name STARTSWITH "Uni", and other simple filter
 * }
 */
public class SimpleExpression implements Expression {

	public String key;
	public Object value;

	/**
	 * Default is empty, which means the default operator based on the value
	 *
	 *     <ul>
	 *     	 <li>{@code {"Status": ["A", "B"]} means Status is either A or B } </li>
	 *       <li>{@code {"Status": "A"} means Status equals A } </li>
	 *     </ul>
	 */
    public String operator = "";

    public SimpleExpression() {
    }

    public SimpleExpression(String key, Object value) {
        this.key = key;
        this.value = value;
    }

    public SimpleExpression(String key, Object value, String operator) {
        this.key = key;
        this.value = value;
        this.operator = operator;
    }

    /**
     * Get the effective operator. "IN" for a collection value and "=" for a scalar value if not specified.
     *
     * @return operator
     */
    public String getOperator() {
        if (StringUtils.isNotEmpty(operator)) {
            return operator;
        }
        return value instanceof Collection<?> ? "IN" : "=";
    }

    @Override
    public boolean test(Map<String, Object> fields) {

        var fieldValue = fields.get(key);

        switch (getOperator()) {
            case "=":
                return valueEquals(fieldValue, value);
            case "!=":
                return !valueEquals(fieldValue, value);
            case "IN":
                Collection<?> candidates = value instanceof Collection<?> ? (Collection<?>) value : Collections.singletonList(value);
                return candidates.stream().anyMatch(candidate -> valueEquals(fieldValue, candidate));
            case "STARTSWITH":
                return fieldValue != null && value != null && fieldValue.toString().startsWith(value.toString());
            case "<":
                return fieldValue != null && value != null && compare(fieldValue, value) < 0;
            case "<=":
                return fieldValue != null && value != null && compare(fieldValue, value) <= 0;
            case ">":
                return fieldValue != null && value != null && compare(fieldValue, value) > 0;
            case ">=":
                return fieldValue != null && value != null && compare(fieldValue, value) >= 0;
            default:
                throw new IllegalArgumentException("Not supported operator: " + operator);
        }
    }

    /**
     * Equality between a stored value and a filter value. Numbers are equal by value (1 == 1L == 1.0),
     * and a LocalDate equals its ISO string.
     *
     * @param v1 value 1
     * @param v2 value 2
     * @return whether equal
     */
    public static boolean valueEquals(Object v1, Object v2) {
        if (v1 instanceof Number n1 && v2 instanceof Number n2) {
            return NumberUtil.compare(n1, n2) == 0;
        }
        if (v1 instanceof LocalDate || v2 instanceof LocalDate) {
            return v1 != null && v2 != null && v1.toString().equals(v2.toString());
        }
        return Objects.equals(v1, v2);
    }

    /**
     * Compare two values of the same kind: numbers, dates (LocalDate or ISO string) or strings.
     *
     * @param v1 value 1
     * @param v2 value 2
     * @return negative, zero or positive
     * @throws IllegalArgumentException if the values are not comparable
     */
    public static int compare(Object v1, Object v2) {
        if (v1 instanceof Number n1 && v2 instanceof Number n2) {
            return NumberUtil.compare(n1, n2);
        }
        if (v1 instanceof LocalDate d1 && v2 instanceof LocalDate d2) {
            return d1.compareTo(d2);
        }
        if (v1 instanceof LocalDate d1 && v2 instanceof CharSequence) {
            return d1.compareTo(LocalDate.parse(v2.toString()));
        }
        if (v1 instanceof CharSequence && v2 instanceof LocalDate d2) {
            return LocalDate.parse(v1.toString()).compareTo(d2);
        }
        if (v1 instanceof String s1 && v2 instanceof String s2) {
            return s1.compareTo(s2);
        }
        throw new IllegalArgumentException(String.format("values are not comparable: %s, %s", v1, v2));
    }

    @Override
    public String toString() {
        return String.format("%s %s %s", key, getOperator(), value);
    }
}
