package com.panorama.converter.resolver;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.panorama.converter.model.ConfigNode;

/**
 * Builds the {@link Catalog} of one object type by scanning its scope paths.
 *
 * Rules:
 * - Scope paths are scanned in the given order, entries in document order.
 * - A stub is recorded only when its name has not been seen at all.
 * - A full definition always replaces whatever is recorded, so the last
 *   scanned full definition wins.
 * - Entries keep the position of their first insertion.
 *
 * The resolver keeps no state between calls.
 */
public class ScopeResolver {

    private static final Logger log = LoggerFactory.getLogger(ScopeResolver.class);

    private final ObjectTypeRegistry registry;

    public ScopeResolver() {
        this(ObjectTypeRegistry.defaultRegistry());
    }

    public ScopeResolver(ObjectTypeRegistry registry) {
        this.registry = registry;
    }

    /**
     * Resolves identity and completeness only; no fields are extracted.
     */
    public Catalog resolve(ConfigNode root, String objectType, List<String> scopePaths, StubPredicate isStub) {
        return resolve(root, objectType, scopePaths, isStub, Map.of(), UnaryOperator.identity());
    }

    public Catalog resolve(ConfigNode root, ObjectType type) {
        return resolve(root, type.getKey(), type.getScopePaths(), type.getStubPredicate(),
                type.getFields(), type.getNameTransform());
    }

    /**
     * Resolves every type of the registry, in registry order.
     */
    public ResolvedConfiguration resolveAll(ConfigNode root) {
        Map<String, Catalog> catalogs = new LinkedHashMap<>();
        for (ObjectType type : registry.getTypes()) {
            catalogs.put(type.getKey(), resolve(root, type));
        }
        return new ResolvedConfiguration(catalogs);
    }

    private Catalog resolve(ConfigNode root,
                            String objectType,
                            List<String> scopePaths,
                            StubPredicate isStub,
                            Map<String, FieldExtractor> fields,
                            UnaryOperator<String> nameTransform) {

        Map<String, NamedObject> entries = new LinkedHashMap<>();
        int overrides = 0;

        for (String scopePath : scopePaths) {
            for (ConfigNode node : root.findAll(scopePath)) {
                if (!node.hasName()) {
                    continue;
                }
                String name = nameTransform.apply(node.getName());
                boolean stub = isStub.isStub(node);
                NamedObject existing = entries.get(name);

                if (stub) {
                    if (existing == null) {
                        entries.put(name, build(objectType, name, true, scopePath, node, fields));
                        log.debug("{} '{}': reference-only entry recorded from {}", objectType, name, scopePath);
                    }
                    continue;
                }

                if (existing != null && existing.isFull()) {
                    overrides++;
                    log.debug("{} '{}': definition from {} replaced by {}",
                            objectType, name, existing.getScopePath(), scopePath);
                }
                entries.put(name, build(objectType, name, false, scopePath, node, fields));
            }
        }

        if (!entries.isEmpty()) {
            log.debug("Resolved {} {} entries ({} overrides)", entries.size(), objectType, overrides);
        }
        return new Catalog(objectType, entries);
    }

    private static NamedObject build(String objectType,
                                     String name,
                                     boolean stub,
                                     String scopePath,
                                     ConfigNode node,
                                     Map<String, FieldExtractor> fields) {

        NamedObject.NamedObjectBuilder builder = NamedObject.builder()
                .type(objectType)
                .name(name)
                .stub(stub)
                .scopePath(scopePath)
                .source(node);

        if (!stub) {
            for (Map.Entry<String, FieldExtractor> field : fields.entrySet()) {
                Object value = field.getValue().extract(node);
                if (value != null) {
                    builder.field(field.getKey(), value);
                }
            }
        }
        return builder.build();
    }
}
