package com.panorama.converter.resolver;

import java.util.List;
import java.util.Map;

import com.panorama.converter.model.ConfigNode;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

/**
 * One resolved configuration object: either a full definition or a stub
 * placeholder that only records that the name exists.
 */
@Value
@Builder(toBuilder = true)
public class NamedObject {

    @NonNull
    String type;

    @NonNull
    String name;

    boolean stub;

    /**
     * Scope pattern the retained definition was found under.
     */
    String scopePath;

    @Singular
    Map<String, Object> fields;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    ConfigNode source;

    public boolean isFull() {
        return !stub;
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public String getString(String field) {
        Object value = fields.get(field);
        return value == null ? null : value.toString();
    }

    public boolean getBoolean(String field) {
        return Boolean.TRUE.equals(fields.get(field));
    }

    @SuppressWarnings("unchecked")
    public List<String> getList(String field) {
        Object value = fields.get(field);
        if (value instanceof List<?> list) {
            return (List<String>) list;
        }
        return List.of();
    }

    @SuppressWarnings("unchecked")
    public Map<String, String> getMap(String field) {
        Object value = fields.get(field);
        if (value instanceof Map<?, ?> map) {
            return (Map<String, String>) map;
        }
        return Map.of();
    }
}
