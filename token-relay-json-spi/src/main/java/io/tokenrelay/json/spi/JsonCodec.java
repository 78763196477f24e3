package io.tokenrelay.json.spi;

import java.util.Map;

/**
 * JSON codec used for event payloads, chunk payloads and request bodies.
 *
 * <p>Implementations wrap a JSON library and are discovered through {@link JsonCodecProvider}.
 */
public interface JsonCodec {

    /**
     * Serializes an object to a JSON byte array.
     * @param value the object to serialize
     * @return JSON bytes
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    /**
     * Serializes an object to a JSON string.
     * @param value the object to serialize
     * @return JSON string
     * @throws JsonException if serialization fails
     */
    String writeString(Object value) throws JsonException;

    /**
     * Deserializes a JSON object into an insertion-ordered map.
     * @param data JSON bytes (must be an object)
     * @return the object's fields
     * @throws JsonException if the data is not a JSON object
     */
    Map<String, Object> readMap(byte[] data) throws JsonException;
}
