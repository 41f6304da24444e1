package com.panorama.converter.resolver;

import com.panorama.converter.model.ConfigNode;

/**
 * Reads one field of a catalog entry from its source node.
 * Returning {@code null} means the field is absent and is not recorded.
 */
@FunctionalInterface
public interface FieldExtractor {

    Object extract(ConfigNode entry);
}
