package io.providerbridge.json.spi;

/**
 * Minimal JSON codec used by serializing transports.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.).
 *
 * <p>Values that cross a serializing transport arrive as generic structures (maps, lists,
 * strings, numbers). {@link #convertValue(Object, Class)} turns such a structure into the
 * strongly-typed record the receiving side expects.
 */
public interface JsonCodec {

    // ===== Serialization =====

    /**
     * Serializes an object to a JSON byte array.
     * @param value the object to serialize
     * @return JSON bytes
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    // ===== Deserialization =====

    /**
     * Deserializes JSON bytes to a typed object.
     * @param data JSON bytes
     * @param type target class
     * @return deserialized object
     * @throws JsonException if deserialization fails
     */
    <T> T readValue(byte[] data, Class<T> type) throws JsonException;

    /**
     * Converts an already-deserialized generic value into the given type.
     * @param value generic value (map, list, scalar) or an instance of {@code type}
     * @param type target class
     * @return converted object, or {@code null} for a {@code null} value
     * @throws JsonException if the value cannot be converted
     */
    <T> T convertValue(Object value, Class<T> type) throws JsonException;
}
