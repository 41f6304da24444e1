package com.panorama.converter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.Getter;

/**
 * Compiled path expression over {@link ConfigNode} trees.
 *
 * Supported syntax:
 * <ul>
 *   <li>{@code tag} - child with the given tag, {@code *} matches any tag</li>
 *   <li>{@code a/b} - child steps</li>
 *   <li>{@code .//tag} or {@code a//tag} - nodes at any depth below the current context</li>
 *   <li>{@code tag[@attr='value']} - attribute equality predicate</li>
 * </ul>
 * Results come back in document order without duplicates.
 */
public final class NodePath {

    private static final Pattern STEP = Pattern.compile("^([^\\[\\]]+)(?:\\[@([^=\\]]+)='([^']*)'])?$");
    private static final Map<String, NodePath> CACHE = new ConcurrentHashMap<>();

    @Getter
    private final String expression;
    private final List<Step> steps;

    private NodePath(String expression, List<Step> steps) {
        this.expression = expression;
        this.steps = steps;
    }

    public static NodePath compile(String expression) {
        return CACHE.computeIfAbsent(expression, NodePath::parse);
    }

    private static NodePath parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Path expression must not be blank");
        }
        List<Step> steps = new ArrayList<>();
        String[] parts = expression.trim().split("/", -1);
        boolean descendant = false;
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            if (part.isEmpty()) {
                // leading "/" is treated like a relative path
                descendant = i > 0;
                continue;
            }
            if (part.equals(".")) {
                continue;
            }
            Matcher m = STEP.matcher(part);
            if (!m.matches()) {
                throw new IllegalArgumentException("Invalid path step '" + part + "' in: " + expression);
            }
            steps.add(new Step(m.group(1).trim(), descendant, m.group(2), m.group(3)));
            descendant = false;
        }
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("Path expression has no steps: " + expression);
        }
        return new NodePath(expression, List.copyOf(steps));
    }

    public List<ConfigNode> select(ConfigNode context) {
        List<ConfigNode> current = List.of(context);
        for (Step step : steps) {
            List<ConfigNode> next = new ArrayList<>();
            Set<ConfigNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
            for (ConfigNode node : current) {
                if (step.descendant) {
                    collectDescendants(node, step, next, seen);
                } else {
                    for (ConfigNode c : node.getChildren()) {
                        if (step.matches(c) && seen.add(c)) {
                            next.add(c);
                        }
                    }
                }
            }
            if (next.isEmpty()) {
                return List.of();
            }
            current = next;
        }
        return current;
    }

    public Optional<ConfigNode> first(ConfigNode context) {
        List<ConfigNode> all = select(context);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    private static void collectDescendants(ConfigNode node, Step step, List<ConfigNode> out, Set<ConfigNode> seen) {
        for (ConfigNode c : node.getChildren()) {
            if (step.matches(c) && seen.add(c)) {
                out.add(c);
            }
            collectDescendants(c, step, out, seen);
        }
    }

    @Override
    public String toString() {
        return expression;
    }

    private static final class Step {
        private final String tag;
        private final boolean descendant;
        private final String attribute;
        private final String value;

        private Step(String tag, boolean descendant, String attribute, String value) {
            this.tag = tag;
            this.descendant = descendant;
            this.attribute = attribute;
            this.value = value;
        }

        private boolean matches(ConfigNode node) {
            if (!"*".equals(tag) && !tag.equals(node.getTag())) {
                return false;
            }
            return attribute == null || value.equals(node.getAttribute(attribute));
        }
    }
}
