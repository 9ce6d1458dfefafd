package com.ryuqq.relay.adapter.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.relay.core.fault.DescriptionException;
import com.ryuqq.relay.core.model.ApiConfig;
import com.ryuqq.relay.core.model.ApiDescription;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads a JSON API description once and turns it into an {@link ApiConfig}.
 *
 * <pre>
 * {
 *   "name": "text",
 *   "endpoint": {"port": 8080, "pattern": "/api/{version}/{operation}"},
 *   "exceptions": ["NotFound"],
 *   "operations": [{"name": "upper", "input": ["text"], "output": ["result"]}]
 * }
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class DescriptionLoader {

    private static final TypeReference<LinkedHashMap<String, Object>> DESCRIPTION_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public DescriptionLoader() {
        this(new ObjectMapper());
    }

    public DescriptionLoader(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    /**
     * @param json description text
     * @throws DescriptionException if the text is not a valid description
     */
    public ApiConfig load(String json) {
        try {
            return ApiDescription.fromDescription(require(mapper.readValue(json, DESCRIPTION_TYPE)));
        } catch (JsonProcessingException e) {
            throw new DescriptionException("Malformed description: " + e.getOriginalMessage(), e);
        }
    }

    public ApiConfig load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    /**
     * Reads the whole stream; the caller closes it.
     */
    public ApiConfig load(InputStream in) throws IOException {
        Map<String, Object> description;
        try {
            description = mapper.readValue(in, DESCRIPTION_TYPE);
        } catch (JsonProcessingException e) {
            throw new DescriptionException("Malformed description: " + e.getOriginalMessage(), e);
        }
        return ApiDescription.fromDescription(require(description));
    }

    private static Map<String, Object> require(Map<String, Object> description) {
        if (description == null) {
            throw new DescriptionException("Description must be a JSON object");
        }
        return description;
    }
}
