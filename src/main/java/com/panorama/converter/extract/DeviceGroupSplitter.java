package com.panorama.converter.extract;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.panorama.converter.model.ConfigNode;

/**
 * Runs {@link DeviceGroupExtractor} over several device groups.
 * A group that cannot be found yields a not-found result; the batch goes on.
 */
public class DeviceGroupSplitter {

    private static final Logger log = LoggerFactory.getLogger(DeviceGroupSplitter.class);

    private final DeviceGroupExtractor extractor;

    public DeviceGroupSplitter() {
        this(new DeviceGroupExtractor());
    }

    public DeviceGroupSplitter(DeviceGroupExtractor extractor) {
        this.extractor = extractor;
    }

    /**
     * Distinct device group names in document order.
     */
    public List<String> listDeviceGroups(ConfigNode root) {
        Set<String> names = new LinkedHashSet<>();
        for (ConfigNode dg : root.findAll(DeviceGroupExtractor.DEVICE_GROUP_PATH)) {
            if (dg.hasName()) {
                names.add(dg.getName());
            }
        }
        return new ArrayList<>(names);
    }

    /**
     * @param groupNames groups to extract; every group of the document when empty
     */
    public List<ExtractionResult> split(ConfigNode root, Collection<String> groupNames) {
        List<String> targets = groupNames == null || groupNames.isEmpty()
                ? listDeviceGroups(root)
                : new ArrayList<>(new LinkedHashSet<>(groupNames));

        ConfigNode shared = extractor.mergeShared(root).orElse(null);
        List<ExtractionResult> results = new ArrayList<>();
        for (String groupName : targets) {
            log.info("Processing device group: {}", groupName);
            results.add(extractor.extract(root, groupName, shared));
        }
        long found = results.stream().filter(ExtractionResult::isFound).count();
        log.info("Extracted {} of {} device groups", found, results.size());
        return results;
    }
}
