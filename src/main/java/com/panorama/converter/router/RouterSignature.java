package com.panorama.converter.router;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import lombok.NonNull;
import lombok.Value;

/**
 * Structural identity of a router: its name plus a canonical interface prefix.
 *
 * The prefix is the first {@value #PREFIX_SIZE} attached interfaces, sorted.
 * Two signatures denote the same logical router when the names are equal and
 * the smaller prefix is contained in the larger one. An empty prefix only
 * matches another empty prefix.
 */
@Value
public class RouterSignature {

    static final int PREFIX_SIZE = 5;

    @NonNull
    String name;

    @NonNull
    List<String> interfacePrefix;

    public static RouterSignature of(RouterDescriptor router) {
        List<String> interfaces = router.getInterfaces();
        List<String> prefix = new ArrayList<>(interfaces.subList(0, Math.min(PREFIX_SIZE, interfaces.size())));
        Collections.sort(prefix);
        return new RouterSignature(router.getName(), List.copyOf(prefix));
    }

    public boolean matches(RouterSignature other) {
        if (!name.equals(other.name)) {
            return false;
        }
        if (interfacePrefix.isEmpty() || other.interfacePrefix.isEmpty()) {
            return interfacePrefix.isEmpty() && other.interfacePrefix.isEmpty();
        }
        List<String> smaller = interfacePrefix.size() <= other.interfacePrefix.size() ? interfacePrefix : other.interfacePrefix;
        List<String> larger = smaller == interfacePrefix ? other.interfacePrefix : interfacePrefix;
        Set<String> largerSet = new HashSet<>(larger);
        return largerSet.containsAll(smaller);
    }

    /**
     * Stable textual key, e.g. {@code VR1_ethernet1/1,ethernet1/2}.
     */
    public String key() {
        return name + "_" + String.join(",", interfacePrefix);
    }

    @Override
    public String toString() {
        return key();
    }
}
