package com.panorama.converter.router;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class StaticRoute {

    @NonNull
    String name;

    String destination;

    String nexthopIp;

    /**
     * Next-hop router name (next-vr or next-lr).
     */
    String nexthopRouter;

    String metric;
}
