package io.github.crmrecords.util;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Simple Json Converter based on jackson. Do common initialization and wrap
 * some method for simple use.
 *
 * <p>
 * Dates are written as ISO-8601 strings (e.g. "2024-12-31"), so a record's map converts to a POJO with LocalDate fields.
 * </p>
 */
public class JsonUtil {

	private static ObjectMapper mapper = new ObjectMapper();
	private static ObjectMapper noIndentMapper = new ObjectMapper();

	JsonUtil() {
	}

	static {
		init(mapper);
		init(noIndentMapper);

		mapper.enable(SerializationFeature.INDENT_OUTPUT);
	}

	private static final Logger log = LoggerFactory.getLogger(JsonUtil.class);

	/**
	 * common initialization
	 *
	 * @param mapper
	 */
	private static void init(ObjectMapper mapper) {
		mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false) //
				.setSerializationInclusion(JsonInclude.Include.NON_NULL) //
				.setVisibility(PropertyAccessor.FIELD, Visibility.ANY);
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
	}

	public static String toJson(Object object) {
		try {
			return mapper.writeValueAsString(object);
		} catch (JsonProcessingException e) {
			processException(object, e);
		}
		return "";
	}

	public static String toJsonNoIndent(Object object) {
		try {
			return noIndentMapper.writeValueAsString(object);
		} catch (JsonProcessingException e) {
			processException(object, e);
		}
		return "";
	}

	/**
	 * Convert to Map
	 *
	 * @param object
	 * @return
	 */
	public static Map<String, Object> toMap(Object object) {
		return mapper.convertValue(object, new TypeReference<LinkedHashMap<String, Object>>() {
		});
	}

	public static <T> T fromJson(String json, Class<T> classOfT) {
		try {
			return mapper.readValue(json, classOfT);
		} catch (Exception e) {
			processException(json, e);
		}
		return null;
	}

	public static <T> T fromMap(Map<String, Object> map, Class<T> classOfT) {
		try {
			return mapper.convertValue(map, classOfT);
		} catch (Exception e) {
			processException(map, e);
		}
		return null;
	}

	private static void processException(Object object, Exception e) {
		log.error("json error: ", e);
		throw new IllegalArgumentException("json process error.", e);
	}

}
