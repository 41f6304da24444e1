package com.panorama.converter.resolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.panorama.converter.model.ConfigNode;

/**
 * Building blocks for the per-type field tables in {@link ObjectTypeRegistry}.
 */
public final class FieldExtractors {

    private static final String YES = "yes";

    private FieldExtractors() {
        // Utility class
    }

    /**
     * Text of the first node at {@code path}.
     */
    public static FieldExtractor text(String path) {
        return entry -> entry.findText(path);
    }

    public static FieldExtractor attribute(String attributeName) {
        return entry -> entry.getAttribute(attributeName);
    }

    public static FieldExtractor constant(Object value) {
        return entry -> value;
    }

    /**
     * Non-empty texts of every {@code member} below any {@code path} element.
     */
    public static FieldExtractor members(String path) {
        return texts(".//" + path + "/member");
    }

    /**
     * Non-empty texts of every node matching {@code path}.
     */
    public static FieldExtractor texts(String path) {
        return entry -> collectTexts(entry, path);
    }

    /**
     * Names of every named node matching {@code path}.
     */
    public static FieldExtractor entryNames(String path) {
        return entry -> {
            List<String> names = new ArrayList<>();
            for (ConfigNode n : entry.findAll(path)) {
                if (n.hasName()) {
                    names.add(n.getName());
                }
            }
            return Collections.unmodifiableList(names);
        };
    }

    /**
     * {@code true} only when the text at {@code path} is {@code yes}; absent means {@code false}.
     */
    public static FieldExtractor flag(String path) {
        return entry -> YES.equals(entry.findText(path));
    }

    /**
     * Like {@link #flag(String)} but absent stays absent.
     */
    public static FieldExtractor optionalFlag(String path) {
        return entry -> entry.find(path).map(n -> YES.equals(n.getText())).orElse(null);
    }

    /**
     * First of {@code tags} present as a child of {@code basePath}, else {@code defaultValue}.
     */
    public static FieldExtractor firstPresent(String basePath, String defaultValue, String... tags) {
        return entry -> {
            for (String tag : tags) {
                if (entry.has(join(basePath, tag))) {
                    return tag;
                }
            }
            return defaultValue;
        };
    }

    /**
     * Last of {@code tags} present as a child of {@code basePath}, else {@code null}.
     * Later alternatives take precedence when a malformed entry carries several.
     */
    public static FieldExtractor lastPresent(String basePath, String... tags) {
        return entry -> {
            String found = null;
            for (String tag : tags) {
                if (entry.has(join(basePath, tag))) {
                    found = tag;
                }
            }
            return found;
        };
    }

    /**
     * Text of the last of {@code paths} that is present.
     */
    public static FieldExtractor lastPresentText(String... paths) {
        return entry -> {
            String value = null;
            for (String path : paths) {
                if (entry.has(path)) {
                    value = entry.findText(path);
                }
            }
            return value;
        };
    }

    /**
     * Entry name to child text, for every named node matching {@code path}.
     */
    public static FieldExtractor entryTextMap(String path, String childPath) {
        return entry -> {
            Map<String, String> result = new LinkedHashMap<>();
            for (ConfigNode n : entry.findAll(path)) {
                if (n.hasName()) {
                    result.put(n.getName(), n.findText(childPath));
                }
            }
            return Collections.unmodifiableMap(result);
        };
    }

    static List<String> collectTexts(ConfigNode entry, String path) {
        List<String> values = new ArrayList<>();
        for (ConfigNode n : entry.findAll(path)) {
            String t = n.getText();
            if (t != null && !t.isEmpty()) {
                values.add(t);
            }
        }
        return Collections.unmodifiableList(values);
    }

    private static String join(String basePath, String tag) {
        return basePath == null || basePath.isEmpty() ? tag : basePath + "/" + tag;
    }
}
