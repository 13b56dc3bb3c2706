package com.warden.engine.infrastructure.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON encoding of the records the adapters persist (health reports, alert details, recovery
 * actions). Instants are written as ISO-8601 strings.
 */
public final class JsonCodec {

    private static final ObjectMapper MAPPER = createMapper();

    private JsonCodec() {
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * @throws JsonCodecException if {@code value} cannot be serialized
     */
    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new JsonCodecException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * @throws JsonCodecException if {@code json} is malformed or does not match {@code type}
     */
    public static <T> T read(String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new JsonCodecException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    /**
     * @throws JsonCodecException if {@code json} is malformed or does not match {@code type}
     */
    public static <T> T read(String json, TypeReference<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new JsonCodecException("Failed to deserialize " + type.getType().getTypeName(), e);
        }
    }

    public static class JsonCodecException extends RuntimeException {

        public JsonCodecException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
