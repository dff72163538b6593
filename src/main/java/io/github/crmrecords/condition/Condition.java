package io.github.crmrecords.condition;

import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import io.github.crmrecords.util.Checker;
import io.github.crmrecords.util.JsonUtil;
import org.apache.commons.lang3.StringUtils;

/**
 * Condition for query. (e.g. filter / sort / offset / limit)
 *
 * <p>
 * {@code
 * Condition.filter("Name", "IBM");                        // Name = "IBM"
 * Condition.filter("LastName IN", List.of("Doe", "Jane")); // LastName IN ("Doe", "Jane")
 * Condition.filter("StageName !=", "Closed Won", "Amount >", 1000).sort("Amount", "DESC").limit(10);
 * }
 * </p>
 *
 * <p>
 * Filters are combined with AND.
 * </p>
 */
public class Condition {

    /**
     * Default constructor
     */
    public Condition() {
    }

    /**
     * A constructor accepting a map as filter
     *
     * @param filter map as filter directly
     */
    public Condition(Map<String, Object> filter) {
        this.filter = filter;
    }

    public Map<String, Object> filter = new LinkedHashMap<>();

    public List<String> sort = List.of();

    public int offset = 0;

    /**
     * max number of records to return. -1 means no limit
     */
    public int limit = -1;

    public static final Pattern simpleExpressionPattern = Pattern
            .compile("(.+)\\s(STARTSWITH|IN|=|!=|<|<=|>|>=)\\s*$");

    /**
     * add filters
     *
     * @param filters search filters using key / value pair.
     * @return condition
     */
    public static Condition filter(Object... filters) {

        Condition cond = new Condition();
        if (filters == null || filters.length == 0) {
            return cond;
        }

        Checker.check(filters.length % 2 == 0, "filters must be key/value pairs like: \"LastName\", \"Doe\"");

        for (int i = 0; i < filters.length; i++) {
            if (i % 2 == 0) {
                cond.filter.put(filters[i].toString(), filters[i + 1]);
            }
        }

        return cond;
    }

	/**
	 * set sorts in the following way. Overwrite previous sorts.
	 *
	 * {@code
	 * Condition.filter().sort("LastName", "ASC");
	 * }
	 *
	 * @param sorts sort strings
	 * @return condition
	 */
	public Condition sort(String... sorts) {

		if (sorts == null || sorts.length == 0) {
			return this;
		}

		Checker.check(sorts.length % 2 == 0, "sorts must be field/order pairs like: \"Name\", \"DESC\" ");

		this.sort = new ArrayList<>();
		for (int i = 0; i < sorts.length; i++) {
			if (i % 2 == 1) {
				Checker.check("ASC".equalsIgnoreCase(sorts[i]) || "DESC".equalsIgnoreCase(sorts[i]),
						String.format("Invalid order,expect: ASC / DESC, provided: %s", sorts[i]));
			}
			sort.add(sorts[i]);
		}

		return this;
	}

	/**
	 * set the offset
	 * @param offset offset
	 * @return condition
	 */
	public Condition offset(int offset) {
		Checker.check(offset >= 0, "offset should be >= 0, provided: " + offset);
		this.offset = offset;
		return this;
	}

	/**
	 * set the limit. -1 means no limit
	 *
	 * @param limit limit
	 * @return condition
	 */
	public Condition limit(int limit) {
		Checker.check(limit >= -1, "limit should be >= -1, provided: " + limit);
		this.limit = limit;
		return this;
	}

    /**
     * Parse the filter into expressions. e.g. {"Amount >": 1000} to SimpleExpression("Amount", 1000, ">")
     *
     * @return expressions, to be combined with AND
     */
    public List<SimpleExpression> toExpressions() {
        return filter.entrySet().stream().map(entry -> parse(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
    }

    /**
     * Get the field names used by filter and sort
     *
     * @return field names
     */
    public Set<String> getFieldNames() {
        var ret = new LinkedHashSet<String>();
        toExpressions().forEach(exp -> ret.add(exp.key));
        for (int i = 0; i < sort.size(); i += 2) {
            ret.add(sort.get(i));
        }
        return ret;
    }

    static SimpleExpression parse(String key, Object value) {
        var matcher = simpleExpressionPattern.matcher(key);
        if (matcher.matches()) {
            return new SimpleExpression(StringUtils.trim(matcher.group(1)), value, matcher.group(2));
        }
        return new SimpleExpression(StringUtils.trim(key), value);
    }

    /**
     * Copy a condition
     *
     * @param other condition to copy
     * @return a new condition
     */
    public static Condition copy(Condition other) {
        if (other == null) {
            return null;
        }
        var cond = new Condition(new LinkedHashMap<>(other.filter));
        cond.sort = new ArrayList<>(other.sort);
        cond.offset = other.offset;
        cond.limit = other.limit;
        return cond;
    }

    @Override
    public String toString() {
        return JsonUtil.toJsonNoIndent(this);
    }
}
