package com.panorama.converter.resolver;

import java.util.List;

/**
 * Stock {@link StubPredicate} implementations.
 */
public final class StubPredicates {

    public static final String IDENTITY_MARKER = "id";

    private static final StubPredicate NEVER = entry -> false;

    private StubPredicates() {
        // Utility class
    }

    /**
     * For object types that have no reference-only form.
     */
    public static StubPredicate never() {
        return NEVER;
    }

    /**
     * An entry is a stub when it carries the {@code id} marker child and none of
     * the given content paths.
     */
    public static StubPredicate identityOnly(String... contentPaths) {
        List<String> paths = List.of(contentPaths);
        return entry -> {
            if (entry.child(IDENTITY_MARKER).isEmpty()) {
                return false;
            }
            for (String path : paths) {
                if (entry.has(path)) {
                    return false;
                }
            }
            return true;
        };
    }
}
