package com.example.tenantstore.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts typed entities to and from the JSON-like maps a {@link DocumentStore} works with.
 * Instants are written as epoch milliseconds so stored timestamps sort numerically.
 */
public class EntityMapper {

    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public EntityMapper() {
        this(new ObjectMapper());
    }

    public EntityMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .enable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DATE_TIMESTAMPS_AS_NANOSECONDS)
                .disable(DeserializationFeature.READ_DATE_TIMESTAMPS_AS_NANOSECONDS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public Map<String, Object> toDocument(Object entity) {
        return objectMapper.convertValue(entity, DOCUMENT);
    }

    public <T> T fromDocument(Map<String, Object> document, Class<T> type) {
        return objectMapper.convertValue(document, type);
    }

    /** Deep copy, so repositories never mutate the caller's instance. */
    public <T> T copy(T entity, Class<T> type) {
        return fromDocument(toDocument(entity), type);
    }
}
