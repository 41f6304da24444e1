package com.panorama.converter.resolver;

import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

/**
 * Declarative description of one kind of named configuration object: where its
 * entries live, how to recognise a reference-only entry and which fields to read.
 */
@Value
@Builder(toBuilder = true)
public class ObjectType {

    /**
     * Catalog key, e.g. {@code address} or {@code security-rule}.
     */
    @NonNull
    String key;

    /**
     * Human readable label used in summaries.
     */
    @NonNull
    String label;

    /**
     * Search patterns in scan order. Later full definitions replace earlier ones.
     */
    @NonNull
    @Singular
    List<String> scopePaths;

    @NonNull
    @Builder.Default
    @ToString.Exclude
    StubPredicate stubPredicate = StubPredicates.never();

    @NonNull
    @Singular("field")
    @ToString.Exclude
    Map<String, FieldExtractor> fields;

    /**
     * Maps the raw {@code name} attribute to the catalog name (VLAN units become {@code vlan.<n>}).
     */
    @NonNull
    @Builder.Default
    @ToString.Exclude
    UnaryOperator<String> nameTransform = UnaryOperator.identity();
}
