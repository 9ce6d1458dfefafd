package com.ryuqq.relay.adapter.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.ryuqq.relay.core.spi.Codec;
import com.ryuqq.relay.core.spi.CodecException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON {@link Codec} over Jackson.
 *
 * <p>Bodies are flat JSON objects. Trailing content after the object, a top-level
 * array or scalar, and {@code null} are all rejected with {@link CodecException}.
 * Key order is preserved.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class JacksonCodec implements Codec {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final ObjectReader reader;

    public JacksonCodec() {
        this(new ObjectMapper());
    }

    public JacksonCodec(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
        this.reader = mapper.readerFor(MAP_TYPE).with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @Override
    public String serialize(Map<String, Object> values) {
        try {
            return mapper.writeValueAsString(values == null ? Map.of() : values);
        } catch (JsonProcessingException e) {
            throw new CodecException("Cannot encode values: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public Map<String, Object> deserialize(String text) {
        if (text == null || text.isBlank()) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> values;
        try {
            values = reader.readValue(text);
        } catch (JsonProcessingException e) {
            throw new CodecException("Malformed JSON body: " + e.getOriginalMessage(), e);
        }
        if (values == null) {
            throw new CodecException("Malformed JSON body: expected an object but got null");
        }
        return values;
    }
}
