package com.panorama.converter.router;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.panorama.converter.model.ConfigNode;

/**
 * Collects virtual and logical routers from every template and from the device
 * level, collapsing duplicates of the same router.
 *
 * Duplicates are detected by {@link RouterSignature#matches(RouterSignature)}.
 * A later duplicate replaces the stored one only when it has strictly more
 * interfaces; otherwise the first one seen is kept. Routers with the same name
 * but unrelated interfaces are kept side by side.
 */
public class RouterAggregator {

    private static final Logger log = LoggerFactory.getLogger(RouterAggregator.class);

    static final String TEMPLATE_PATH = ".//template/entry";
    static final String INTERFACE_PATH = ".//interface/member";
    static final String STATIC_ROUTE_PATH = ".//routing-table/ip/static-route/entry";

    public List<RouterDescriptor> resolveRouters(ConfigNode root) {
        List<RouterDescriptor> result = new ArrayList<>();
        for (RouterKind kind : RouterKind.values()) {
            List<RouterDescriptor> routers = resolveRouters(root, kind);
            log.info("Found {} unique {} entries", routers.size(), kind.getContainerTag());
            result.addAll(routers);
        }
        return result;
    }

    public List<RouterDescriptor> resolveRouters(ConfigNode root, RouterKind kind) {
        List<RouterDescriptor> retained = new ArrayList<>();

        for (ConfigNode template : root.findAll(TEMPLATE_PATH)) {
            String templateName = template.getName();
            if (templateName == null) {
                continue;
            }
            for (ConfigNode router : template.findAll(".//network/" + kind.getContainerTag() + "/entry")) {
                retain(retained, describe(router, templateName, kind));
            }
        }

        for (ConfigNode router : root.findAll(".//devices/entry/network/" + kind.getContainerTag() + "/entry")) {
            retain(retained, describe(router, RouterDescriptor.DEVICE_SPECIFIC, kind));
        }
        return retained;
    }

    private static void retain(List<RouterDescriptor> retained, RouterDescriptor candidate) {
        if (candidate == null) {
            return;
        }
        RouterSignature signature = candidate.signature();
        for (int i = 0; i < retained.size(); i++) {
            RouterDescriptor existing = retained.get(i);
            if (!existing.signature().matches(signature)) {
                continue;
            }
            if (candidate.interfaceCount() > existing.interfaceCount()) {
                log.debug("Router {} from {} replaces the one from {} ({} > {} interfaces)",
                        candidate.getName(), candidate.getTemplate(), existing.getTemplate(),
                        candidate.interfaceCount(), existing.interfaceCount());
                retained.set(i, candidate);
                absorb(retained, candidate, i);
            } else {
                log.debug("Router {} from {} is a duplicate of the one from {}",
                        candidate.getName(), candidate.getTemplate(), existing.getTemplate());
            }
            return;
        }
        retained.add(candidate);
    }

    /**
     * Drops every other retained router that the new one at {@code keep} covers.
     * Containment is not transitive, so a wider router can cover several entries
     * that did not match each other.
     */
    private static void absorb(List<RouterDescriptor> retained, RouterDescriptor winner, int keep) {
        RouterSignature signature = winner.signature();
        Iterator<RouterDescriptor> it = retained.iterator();
        int index = 0;
        while (it.hasNext()) {
            RouterDescriptor other = it.next();
            if (index++ != keep && other.interfaceCount() <= winner.interfaceCount()
                    && other.signature().matches(signature)) {
                log.debug("Router {} from {} is covered by the one from {}",
                        other.getName(), other.getTemplate(), winner.getTemplate());
                it.remove();
            }
        }
    }

    private static RouterDescriptor describe(ConfigNode router, String template, RouterKind kind) {
        if (!router.hasName()) {
            return null;
        }
        RouterDescriptor.RouterDescriptorBuilder builder = RouterDescriptor.builder()
                .name(router.getName())
                .template(template)
                .kind(kind);

        for (ConfigNode member : router.findAll(INTERFACE_PATH)) {
            if (member.getText() != null) {
                builder.interfaceName(member.getText());
            }
        }

        for (ConfigNode route : router.findAll(STATIC_ROUTE_PATH)) {
            if (!route.hasName()) {
                continue;
            }
            builder.staticRoute(StaticRoute.builder()
                    .name(route.getName())
                    .destination(route.findText("destination"))
                    .nexthopIp(route.findText("nexthop/ip-address"))
                    .nexthopRouter(route.findText("nexthop/" + kind.getNextRouterTag()))
                    .metric(route.findText("metric"))
                    .build());
        }
        return builder.build();
    }
}
