package io.github.crmrecords.util;

import org.apache.commons.lang3.StringUtils;

import java.util.Collection;

/**
 * A util class to check if some arguments are valid. If not, throw IllegalArgumentException
 *
 */
public class Checker {

	Checker(){
	}

	/**
	 * Check if the result is true. If not, throw IllegalArgumentException with message
	 * @param result
	 * @param message
	 */
	public static void check(boolean result, String message) {

		if (!result) {
			throw new IllegalArgumentException(message);
		}

	}

	/**
	 * Check if the target is not null. If null, throw IllegalArgumentException with name
	 * @param target
	 * @param name
	 * @return target
	 */
	public static <T> T checkNotNull(T target, String name) {

		if (target == null) {
			throw new IllegalArgumentException(String.format("%s should not be null", name));
		}

        return target;

	}

	/**
	 * Check if the target is not blank. If blank, throw IllegalArgumentException with name
	 * @param target
	 * @param name
	 * @return target
	 */
	public static String checkNotBlank(String target, String name) {

		if (StringUtils.isBlank(target)) {
			throw new IllegalArgumentException(String.format("%s should be non-blank", name));
		}

        return target;

	}

    /**
     * Check every element of the collection is not null. The collection itself may be empty.
     * @param target
     * @param name
     * @return target
     */
    public static <T> Collection<T> checkNoNullElement(Collection<T> target, String name) {

        checkNotNull(target, name);
        for (var element : target) {
            if (element == null) {
                throw new IllegalArgumentException(String.format("%s should not contain null element", name));
            }
        }

        return target;
    }
}
