package com.panorama.converter.resolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Resolved objects of one type, one entry per name, in first-insertion order.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Catalog {

    private final String type;
    private final Map<String, NamedObject> entries;

    public Catalog(String type, Map<String, NamedObject> entries) {
        this.type = type;
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static Catalog empty(String type) {
        return new Catalog(type, Map.of());
    }

    public Optional<NamedObject> get(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    public List<NamedObject> objects() {
        return new ArrayList<>(entries.values());
    }

    public List<String> names() {
        return new ArrayList<>(entries.keySet());
    }

    public List<NamedObject> fullObjects() {
        return entries.values().stream().filter(NamedObject::isFull).toList();
    }

    public long stubCount() {
        return entries.values().stream().filter(NamedObject::isStub).count();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
