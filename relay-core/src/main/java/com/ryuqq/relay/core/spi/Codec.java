package com.ryuqq.relay.core.spi;

import java.util.Map;

/**
 * Serializes containers to and from the text body carried by a {@link Transport}.
 *
 * <p>Implementations must be thread-safe; one codec is shared by every processor
 * of a client or service.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface Codec {

    /**
     * Encodes a map of wire-friendly values.
     *
     * @param values keys and values to encode
     * @return text body
     * @throws CodecException if a value cannot be encoded
     */
    String serialize(Map<String, Object> values) throws CodecException;

    /**
     * Decodes a text body into a mutable map.
     *
     * <p>An empty or blank body decodes to an empty map. Any other body must be a
     * single object.</p>
     *
     * @param text text body
     * @return decoded keys and values
     * @throws CodecException if the text is not a valid encoded object
     */
    Map<String, Object> deserialize(String text) throws CodecException;

    /**
     * Media type written on HTTP responses and requests.
     */
    default String contentType() {
        return "application/json";
    }
}
