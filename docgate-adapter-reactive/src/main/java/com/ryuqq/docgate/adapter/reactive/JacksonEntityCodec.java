package com.ryuqq.docgate.adapter.reactive;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.docgate.application.repository.EntityCodec;

import java.util.Map;

/**
 * Jackson implementation of {@link EntityCodec}.
 *
 * <p>Converts entities to payload maps and back with {@link ObjectMapper#convertValue}.
 * The default mapper ignores unknown properties, so injected id fields do not break
 * entities that do not declare them. Conversion failures surface as
 * {@link IllegalArgumentException}.</p>
 *
 * @param <T> entity type
 * @author DocGate Team
 * @since 1.0.0
 */
public final class JacksonEntityCodec<T> implements EntityCodec<T> {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final Class<T> type;

    /**
     * Creates a codec with a default ObjectMapper.
     *
     * @param type entity class
     */
    public JacksonEntityCodec(Class<T> type) {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false), type);
    }

    /**
     * Creates a codec with a custom ObjectMapper.
     *
     * @param mapper the ObjectMapper to use
     * @param type entity class
     * @throws IllegalArgumentException if mapper or type is null
     */
    public JacksonEntityCodec(ObjectMapper mapper, Class<T> type) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        this.mapper = mapper;
        this.type = type;
    }

    @Override
    public Map<String, Object> toPayload(T entity) {
        return mapper.convertValue(entity, PAYLOAD_TYPE);
    }

    @Override
    public T fromPayload(Map<String, Object> payload) {
        return mapper.convertValue(payload, type);
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     *
     * @return the mapper
     */
    public ObjectMapper getMapper() {
        return mapper;
    }
}
