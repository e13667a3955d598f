package io.dwolla.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jspecify.annotations.Nullable;

/**
 * JSON helpers built around the shared {@link ObjectMapper}.
 */
public final class Utils {

    /**
     * Mapper used for every request and response body. Null properties are omitted on write
     * and unknown properties are ignored on read, since the API adds fields over time.
     */
    public static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private Utils() {
    }

    /**
     * Reads a value of a possibly generic type, e.g. one built with
     * {@code OBJECT_MAPPER.constructType(new TypeReference<List<Customer>>() {})}.
     */
    public static <T> T unmarshalFrom(String data, JavaType type) throws JsonProcessingException {
        return OBJECT_MAPPER.readValue(data, type);
    }

    public static <T> T unmarshalFrom(String data, Class<T> type) throws JsonProcessingException {
        return OBJECT_MAPPER.readValue(data, type);
    }

    public static String marshal(Object value) throws JsonProcessingException {
        return OBJECT_MAPPER.writeValueAsString(value);
    }

    public static <T> T defaultIfNull(@Nullable T value, T defaultValue) {
        return value == null ? defaultValue : value;
    }
}
