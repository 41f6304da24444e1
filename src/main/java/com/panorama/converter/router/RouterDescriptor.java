package com.panorama.converter.router;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One router definition as found in a template or at device level.
 */
@Value
@Builder(toBuilder = true)
public class RouterDescriptor {

    public static final String DEVICE_SPECIFIC = "device-specific";

    @NonNull
    String name;

    /**
     * Template name, or {@value #DEVICE_SPECIFIC} for device-level routers.
     */
    @NonNull
    String template;

    @NonNull
    RouterKind kind;

    @Singular("interfaceName")
    List<String> interfaces;

    @Singular
    List<StaticRoute> staticRoutes;

    public int interfaceCount() {
        return interfaces.size();
    }

    public RouterSignature signature() {
        return RouterSignature.of(this);
    }
}
