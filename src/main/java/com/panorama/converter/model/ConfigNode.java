package com.panorama.converter.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

/**
 * Immutable element of a loaded configuration document.
 *
 * A node carries its tag, its attributes (the {@code name} attribute is the
 * identity of named entries), its ordered children and optional text content.
 * Nodes are never mutated after construction; components that need a modified
 * tree build new nodes with {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class ConfigNode {

    public static final String NAME_ATTRIBUTE = "name";

    @NonNull
    String tag;

    @Singular
    Map<String, String> attributes;

    @Singular
    @ToString.Exclude
    List<ConfigNode> children;

    String text;

    public static ConfigNode element(String tag) {
        return ConfigNode.builder().tag(tag).build();
    }

    public static ConfigNode entry(String name) {
        return ConfigNode.builder().tag("entry").attribute(NAME_ATTRIBUTE, name).build();
    }

    /**
     * @return the {@code name} attribute, or {@code null} when the node has none
     */
    public String getName() {
        return attributes.get(NAME_ATTRIBUTE);
    }

    public String getAttribute(String attributeName) {
        return attributes.get(attributeName);
    }

    public boolean hasName() {
        String name = getName();
        return name != null && !name.isEmpty();
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public Optional<ConfigNode> child(String childTag) {
        for (ConfigNode c : children) {
            if (c.tag.equals(childTag)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    public List<ConfigNode> children(String childTag) {
        List<ConfigNode> result = new ArrayList<>();
        for (ConfigNode c : children) {
            if (c.tag.equals(childTag)) {
                result.add(c);
            }
        }
        return result;
    }

    /**
     * Named children with the given tag and name.
     */
    public Optional<ConfigNode> namedChild(String childTag, String childName) {
        for (ConfigNode c : children) {
            if (c.tag.equals(childTag) && childName.equals(c.getName())) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    public List<ConfigNode> findAll(String path) {
        return NodePath.compile(path).select(this);
    }

    public Optional<ConfigNode> find(String path) {
        return NodePath.compile(path).first(this);
    }

    public boolean has(String path) {
        return find(path).isPresent();
    }

    /**
     * Text of the first node matching {@code path}, or {@code null} when no node
     * matches or the matching node carries no text.
     */
    public String findText(String path) {
        return find(path).map(ConfigNode::getText).orElse(null);
    }

    /**
     * All nodes below this one, depth first, in document order. This node is not included.
     */
    public List<ConfigNode> descendants() {
        List<ConfigNode> out = new ArrayList<>();
        collectDescendants(this, out);
        return out;
    }

    private static void collectDescendants(ConfigNode node, List<ConfigNode> out) {
        for (ConfigNode c : node.children) {
            out.add(c);
            collectDescendants(c, out);
        }
    }

    /**
     * Number of nodes in this subtree, this node included.
     */
    public int size() {
        int count = 1;
        for (ConfigNode c : children) {
            count += c.size();
        }
        return count;
    }
}
