package com.panorama.converter.render;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Naming and quoting rules for generated Terraform.
 */
public class TerraformNaming {

    private TerraformNaming() {
        // Utility class
    }

    /**
     * Resource name: anything outside {@code [a-zA-Z0-9_]} becomes {@code _},
     * surrounding underscores are trimmed, a leading digit gets a {@code _}
     * prefix, and the result is lower-cased.
     */
    public static String sanitizeName(String name) {
        if (name == null) {
            return "";
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_]", "_");
        sanitized = sanitized.replaceAll("^_+|_+$", "");
        if (!sanitized.isEmpty() && Character.isDigit(sanitized.charAt(0))) {
            sanitized = "_" + sanitized;
        }
        return sanitized.toLowerCase(Locale.ROOT);
    }

    /**
     * Double-quoted HCL string literal; {@code null} renders as {@code ""}.
     */
    public static String escapeString(String value) {
        if (value == null) {
            return "\"\"";
        }
        String escaped = value
                .replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n");
        return "\"" + escaped + "\"";
    }

    /**
     * Comma-separated quoted values, e.g. {@code "a", "b"}.
     */
    public static String escapeList(List<String> values) {
        return values.stream().map(TerraformNaming::escapeString).collect(Collectors.joining(", "));
    }

    /**
     * Hands out sanitized names, suffixing repeats with {@code _2}, {@code _3}, ...
     */
    public static class UniqueNames {

        private final Map<String, Integer> counts = new HashMap<>();

        public String next(String name) {
            String base = sanitizeName(name);
            int count = counts.merge(base, 1, Integer::sum);
            return count == 1 ? base : base + "_" + count;
        }
    }
}
