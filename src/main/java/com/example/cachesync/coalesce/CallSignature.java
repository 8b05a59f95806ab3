package com.example.cachesync.coalesce;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.Map;
import java.util.Objects;

/**
 * Identity of a remote call: operation name plus its parameters serialized as JSON with
 * map keys and bean properties sorted at every level, so parameter order never matters.
 */
public final class CallSignature {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .build();

    private final String value;

    private CallSignature(String value) {
        this.value = value;
    }

    public static CallSignature of(String operation, Map<String, ?> params) {
        Objects.requireNonNull(operation, "operation");
        if (params == null || params.isEmpty()) {
            return new CallSignature(operation + "{}");
        }
        try {
            return new CallSignature(operation + CANONICAL.writeValueAsString(params));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Parameters of " + operation + " are not serializable", e);
        }
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof CallSignature && value.equals(((CallSignature) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
