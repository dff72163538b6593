package io.github.crmrecords.util;

import io.github.cdimascio.dotenv.Dotenv;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * A simple util to get env variables from System's Environment variables or .env file
 */
public class EnvUtil {

    static Dotenv dotenv = Dotenv.configure().ignoreIfMalformed().ignoreIfMissing().load();

    /**
     * get env variable as String, or return a default value.
     *
     * @param envName      env variable name
     * @param defaultValue default value when env variable not exist
     * @return return default value of not found
     */
    public static String getOrDefault(String envName, String defaultValue) {
        var value = System.getenv(envName);
        return StringUtils.isNotEmpty(value) ? value : dotenv.get(envName, defaultValue == null ? "" : defaultValue);

    }

    /**
     * get env variable as int. return the default value if not exist or not a number
     *
     * @param envName      env variable name
     * @param defaultValue default value
     * @return int value
     */
    public static int getIntOrDefault(String envName, int defaultValue) {
        return NumberUtils.toInt(getOrDefault(envName, ""), defaultValue);
    }

    /**
     * get env variable as boolean("true" / "false"). return the default value if not exist
     *
     * @param envName      env variable name
     * @param defaultValue default value
     * @return boolean value
     */
    public static boolean getBooleanOrDefault(String envName, boolean defaultValue) {
        var value = getOrDefault(envName, "");
        return StringUtils.isEmpty(value) ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    /**
     * get env variable as String
     * @param envName env variable name
     * @return env variable value
     */
    public static String get(String envName) {
        var value = System.getenv(envName);
        if (StringUtils.isEmpty(value)) {
            value = dotenv.get(envName);
        }
        return value;
    }
}
