package com.panorama.converter.router;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Routing engines a Panorama template can carry.
 */
@Getter
@RequiredArgsConstructor
public enum RouterKind {

    VIRTUAL("virtual-router", "next-vr"),
    LOGICAL("logical-router", "next-lr");

    /**
     * Container tag under {@code network}.
     */
    private final String containerTag;

    /**
     * Tag below {@code nexthop} naming the next-hop router.
     */
    private final String nextRouterTag;
}
