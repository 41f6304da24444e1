package com.panorama.converter.extract;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.panorama.converter.model.ConfigNode;

/**
 * Merges every {@code shared} section of a document into one.
 *
 * Merge rules, applied per container:
 * - a named child is added unless the container already holds a child with the
 *   same tag and name (the first one adopted is kept);
 * - an unnamed child with children merges recursively into the first unnamed
 *   container of the same tag, or is added when there is none;
 * - an unnamed leaf is added only when the container held no unnamed child of
 *   that tag before the merge; leaves of the section being adopted are kept as
 *   they are, so member lists survive.
 *
 * The first occurrence of a category is therefore adopted in full and later
 * occurrences only contribute named entries and new categories.
 */
public class SharedSectionMerger {

    private static final Logger log = LoggerFactory.getLogger(SharedSectionMerger.class);

    public static final String SHARED_TAG = "shared";

    /**
     * @return the merged section, empty when there is no section to merge
     */
    public Optional<ConfigNode> merge(List<ConfigNode> sections) {
        if (sections.isEmpty()) {
            return Optional.empty();
        }
        List<ConfigNode> merged = new ArrayList<>();
        for (ConfigNode section : sections) {
            merged = mergeChildren(merged, section.getChildren());
        }
        log.debug("Merged {} shared sections into {} categories", sections.size(), merged.size());
        return Optional.of(ConfigNode.builder().tag(SHARED_TAG).children(merged).build());
    }

    public Optional<ConfigNode> mergeAll(ConfigNode root) {
        return merge(root.findAll(".//" + SHARED_TAG));
    }

    private List<ConfigNode> mergeChildren(List<ConfigNode> base, List<ConfigNode> incoming) {
        List<ConfigNode> result = new ArrayList<>(base);
        Set<String> namedKeys = new HashSet<>();
        Map<String, Integer> containers = new HashMap<>();
        Set<String> adoptedTags = new HashSet<>();
        for (int i = 0; i < result.size(); i++) {
            index(result.get(i), i, namedKeys, containers);
            if (!result.get(i).hasName()) {
                adoptedTags.add(result.get(i).getTag());
            }
        }

        for (ConfigNode child : incoming) {
            if (child.hasName()) {
                if (namedKeys.add(namedKey(child))) {
                    result.add(child);
                } else {
                    log.debug("Shared {} '{}' already present, keeping the first definition",
                            child.getTag(), child.getName());
                }
            } else if (child.hasChildren()) {
                Integer index = containers.get(child.getTag());
                if (index != null) {
                    result.set(index, mergeInto(result.get(index), child));
                } else if (adoptedTags.contains(child.getTag())) {
                    log.debug("Shared <{}> already adopted as a value, ignoring later container", child.getTag());
                } else {
                    containers.put(child.getTag(), result.size());
                    result.add(mergeInto(null, child));
                }
            } else if (adoptedTags.contains(child.getTag())) {
                log.debug("Shared <{}> already adopted, ignoring later value '{}'", child.getTag(), child.getText());
            } else {
                result.add(child);
            }
        }
        return result;
    }

    private ConfigNode mergeInto(ConfigNode existing, ConfigNode incoming) {
        ConfigNode target = existing != null ? existing : incoming.toBuilder().clearChildren().build();
        List<ConfigNode> children = mergeChildren(target.getChildren(), incoming.getChildren());
        return target.toBuilder().clearChildren().children(children).build();
    }

    private static void index(ConfigNode node, int position, Set<String> namedKeys, Map<String, Integer> containers) {
        if (node.hasName()) {
            namedKeys.add(namedKey(node));
        } else if (node.hasChildren()) {
            containers.putIfAbsent(node.getTag(), position);
        }
    }

    private static String namedKey(ConfigNode node) {
        return node.getTag() + "/" + node.getName();
    }
}
