package com.panorama.converter.resolver;

import com.panorama.converter.model.ConfigNode;

/**
 * Decides whether an entry is only a reference to a definition that lives in
 * another scope.
 */
@FunctionalInterface
public interface StubPredicate {

    boolean isStub(ConfigNode entry);
}
