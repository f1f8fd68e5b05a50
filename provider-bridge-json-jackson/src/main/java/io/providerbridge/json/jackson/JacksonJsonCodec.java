package io.providerbridge.json.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.providerbridge.json.spi.JsonCodec;
import io.providerbridge.json.spi.JsonException;

import java.util.Objects;

/**
 * Jackson implementation of JsonCodec.
 * Provides JSON serialization/deserialization using Jackson.
 *
 * <p>Byte buffers are written as base64 strings and read back into heap buffers. Records are
 * handled through their components; unknown properties are ignored so either side of a channel
 * can add fields without breaking the other.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with the default ObjectMapper.
     */
    public JacksonJsonCodec() {
        this(defaultMapper());
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public byte[] writeBytes(Object value) throws JsonException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to bytes", e);
        }
    }

    @Override
    public <T> T readValue(byte[] data, Class<T> type) throws JsonException {
        try {
            return mapper.readValue(data, type);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize bytes to " + type.getName(), e);
        }
    }

    @Override
    public <T> T convertValue(Object value, Class<T> type) throws JsonException {
        if (value == null) return null;
        if (type.isInstance(value)) return type.cast(value);
        try {
            return mapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new JsonException("Failed to convert value to " + type.getName(), e);
        }
    }
}
