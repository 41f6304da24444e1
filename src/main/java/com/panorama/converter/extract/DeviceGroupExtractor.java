package com.panorama.converter.extract;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.panorama.converter.model.ConfigNode;

/**
 * Extracts one device group, with the shared objects and network templates it
 * depends on, into a standalone configuration document.
 *
 * Template association:
 * - exact match on the group name with the first matching prefix stripped;
 * - else the first template, in document order, whose name contains the group
 *   name ignoring case;
 * - else no template.
 * The template-stack is the first one listing the group under its devices.
 */
public class DeviceGroupExtractor {

    private static final Logger log = LoggerFactory.getLogger(DeviceGroupExtractor.class);

    public static final List<String> DEFAULT_TEMPLATE_PREFIXES = List.of("DG-", "dg-");
    public static final String DEFAULT_VERSION = "10.0.0";
    public static final String LOCAL_DEVICE = "localhost.localdomain";

    static final String DEVICE_GROUP_PATH = ".//device-group/entry";
    static final String TEMPLATE_PATH = ".//template/entry";
    static final String TEMPLATE_STACK_PATH = ".//template-stack/entry";

    private final List<String> templatePrefixes;
    private final SharedSectionMerger sharedSectionMerger;

    public DeviceGroupExtractor() {
        this(DEFAULT_TEMPLATE_PREFIXES);
    }

    public DeviceGroupExtractor(List<String> templatePrefixes) {
        this.templatePrefixes = List.copyOf(templatePrefixes);
        this.sharedSectionMerger = new SharedSectionMerger();
    }

    public ExtractionResult extract(ConfigNode root, String groupName) {
        return extract(root, groupName, mergeShared(root).orElse(null));
    }

    /**
     * Extracts with a shared section already merged by {@link #mergeShared(ConfigNode)},
     * so a batch over many groups merges only once.
     *
     * @param shared merged shared section of {@code root}, or {@code null} when it has none
     */
    public ExtractionResult extract(ConfigNode root, String groupName, ConfigNode shared) {
        Optional<ConfigNode> deviceGroup = findNamed(root, DEVICE_GROUP_PATH, groupName);
        if (deviceGroup.isEmpty()) {
            log.warn("Device group not found: {}", groupName);
            return ExtractionResult.notFound(groupName);
        }

        ConfigNode template = findTemplate(root, groupName).orElse(null);
        ConfigNode templateStack = findTemplateStack(root, groupName).orElse(null);

        if (template == null) {
            log.debug("No template associated with device group {}", groupName);
        } else {
            log.debug("Device group {} uses template {}", groupName, template.getName());
        }
        if (templateStack != null) {
            log.debug("Device group {} uses template-stack {}", groupName, templateStack.getName());
        }

        DeviceGroupBundle bundle = DeviceGroupBundle.builder()
                .groupName(groupName)
                .deviceGroup(deviceGroup.get())
                .shared(shared)
                .template(template)
                .templateStack(templateStack)
                .document(buildDocument(root, deviceGroup.get(), shared, template, templateStack))
                .build();
        return ExtractionResult.found(bundle);
    }

    public Optional<ConfigNode> mergeShared(ConfigNode root) {
        return sharedSectionMerger.mergeAll(root);
    }

    Optional<ConfigNode> findTemplate(ConfigNode root, String groupName) {
        Optional<ConfigNode> exact = findNamed(root, TEMPLATE_PATH, stripPrefix(groupName));
        if (exact.isPresent()) {
            return exact;
        }
        String needle = groupName.toLowerCase(Locale.ROOT);
        for (ConfigNode template : root.findAll(TEMPLATE_PATH)) {
            String name = template.getName() == null ? "" : template.getName();
            if (name.toLowerCase(Locale.ROOT).contains(needle)) {
                return Optional.of(template);
            }
        }
        return Optional.empty();
    }

    Optional<ConfigNode> findTemplateStack(ConfigNode root, String groupName) {
        for (ConfigNode stack : root.findAll(TEMPLATE_STACK_PATH)) {
            for (ConfigNode device : stack.findAll(".//devices/entry")) {
                if (groupName.equals(device.getName())) {
                    return Optional.of(stack);
                }
            }
        }
        return Optional.empty();
    }

    String stripPrefix(String groupName) {
        for (String prefix : templatePrefixes) {
            if (!prefix.isEmpty() && groupName.startsWith(prefix)) {
                return groupName.substring(prefix.length());
            }
        }
        return groupName;
    }

    private static ConfigNode buildDocument(ConfigNode root,
                                            ConfigNode deviceGroup,
                                            ConfigNode shared,
                                            ConfigNode template,
                                            ConfigNode templateStack) {

        ConfigNode.ConfigNodeBuilder localhost = ConfigNode.builder()
                .tag("entry")
                .attribute(ConfigNode.NAME_ATTRIBUTE, LOCAL_DEVICE)
                .child(wrap("device-group", deviceGroup));
        if (template != null) {
            localhost.child(wrap("template", template));
        }
        if (templateStack != null) {
            localhost.child(wrap("template-stack", templateStack));
        }

        String version = root.getAttribute("version");
        ConfigNode.ConfigNodeBuilder config = ConfigNode.builder()
                .tag("config")
                .attribute("version", version != null ? version : DEFAULT_VERSION)
                .child(ConfigNode.builder().tag("devices").child(localhost.build()).build());
        if (shared != null) {
            config.child(shared);
        }
        return config.build();
    }

    private static ConfigNode wrap(String tag, ConfigNode content) {
        return ConfigNode.builder().tag(tag).child(content).build();
    }

    private static Optional<ConfigNode> findNamed(ConfigNode root, String path, String name) {
        for (ConfigNode node : root.findAll(path)) {
            if (name.equals(node.getName())) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }
}
