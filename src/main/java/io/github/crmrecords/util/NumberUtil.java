package io.github.crmrecords.util;

import java.math.BigDecimal;

/**
 * A util for number processing. e.g. convert Long value to compatible Integer value, compare numbers of different classes
 */
public class NumberUtil {

    NumberUtil() {
    }

    /**
     * Convert Long / Integer / Double / Float to Integer if compatible. If not compatible, remains the origin format
     *
     * @param number number to convert
     * @return Integer if compatible, or the origin number
     */
    public static Number convertNumberToIntIfCompatible(Number number) {

        if (number instanceof Integer) {
            return number;
        } else if (number instanceof Long longValue) {
            if (longValue >= Integer.MIN_VALUE && longValue <= Integer.MAX_VALUE) {
                return longValue.intValue();
            }
        } else if (number instanceof Double doubleValue)  {
            if (doubleValue >= Integer.MIN_VALUE && doubleValue <= Integer.MAX_VALUE && doubleValue % 1 == 0) {
                return doubleValue.intValue();
            }
        } else if (number instanceof Float floatValue) {
            if (floatValue >= Integer.MIN_VALUE && floatValue <= Integer.MAX_VALUE && floatValue % 1 == 0) {
                return floatValue.intValue();
            }
        } else if (number instanceof BigDecimal bigDecimalValue) {
            if(bigDecimalValue.stripTrailingZeros().scale() <= 0
                    && bigDecimalValue.compareTo(BigDecimal.valueOf(Integer.MIN_VALUE)) >= 0
                    && bigDecimalValue.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) <= 0) {
                return bigDecimalValue.intValue();
            }
        }
        return number;
    }

    /**
     * Compare two numbers by value regardless of their classes. e.g. 1 equals 1L equals 1.0d
     *
     * @param n1 number 1
     * @param n2 number 2
     * @return negative, zero or positive as n1 is less than, equal to, or greater than n2
     */
    public static int compare(Number n1, Number n2) {
        if (!isFinite(n1) || !isFinite(n2)) {
            return Double.compare(n1.doubleValue(), n2.doubleValue());
        }
        return toBigDecimal(n1).compareTo(toBigDecimal(n2));
    }

    /**
     * Whether the number is neither NaN nor infinite. Only Double and Float can be non-finite.
     *
     * @param number number to check
     * @return true if finite
     */
    public static boolean isFinite(Number number) {
        if (number instanceof Double doubleValue) {
            return Double.isFinite(doubleValue);
        }
        if (number instanceof Float floatValue) {
            return Float.isFinite(floatValue);
        }
        return true;
    }

    static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal bigDecimalValue) {
            return bigDecimalValue;
        }
        if (number instanceof Integer || number instanceof Long || number instanceof Short || number instanceof Byte) {
            return BigDecimal.valueOf(number.longValue());
        }
        return new BigDecimal(number.toString());
    }

}
