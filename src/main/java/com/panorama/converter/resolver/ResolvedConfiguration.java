package com.panorama.converter.resolver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Catalogs of every resolved object type, keyed by type, in registry order.
 */
@ToString
@EqualsAndHashCode
public final class ResolvedConfiguration {

    private final Map<String, Catalog> catalogs;

    public ResolvedConfiguration(Map<String, Catalog> catalogs) {
        this.catalogs = Collections.unmodifiableMap(new LinkedHashMap<>(catalogs));
    }

    /**
     * @return the catalog of the type, empty when the type was not resolved
     */
    public Catalog catalog(String type) {
        Catalog catalog = catalogs.get(type);
        return catalog != null ? catalog : Catalog.empty(type);
    }

    public Map<String, Catalog> getCatalogs() {
        return catalogs;
    }

    /**
     * Entry count per type, types without entries included.
     */
    public Map<String, Integer> counts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        catalogs.forEach((type, catalog) -> counts.put(type, catalog.size()));
        return counts;
    }

    public int totalObjects() {
        return catalogs.values().stream().mapToInt(Catalog::size).sum();
    }
}
