package dev.pagestack.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable namespace map used by interpolation and conditions.
 * <p>
 * The root store carries the reserved {@code system} and {@code globals} namespaces; every
 * section adds the namespaces its own data declarations produced. A namespace produced by a
 * section replaces an inherited namespace of the same name for that section and its subtree,
 * all other inherited namespaces stay visible.
 */
public final class ScopeStore {

    public static final String SYSTEM = "system";
    public static final String GLOBALS = "globals";

    private static final ScopeStore EMPTY = new ScopeStore(Map.of());

    private final Map<String, Object> namespaces;

    private ScopeStore(Map<String, Object> namespaces) {
        this.namespaces = namespaces;
    }

    public static ScopeStore empty() {
        return EMPTY;
    }

    public static ScopeStore root(Map<String, Object> system, Map<String, Object> globals) {
        Map<String, Object> namespaces = new LinkedHashMap<>();
        namespaces.put(SYSTEM, system == null ? Map.of() : system);
        namespaces.put(GLOBALS, globals == null ? Map.of() : globals);
        return new ScopeStore(Collections.unmodifiableMap(namespaces));
    }

    public ScopeStore merge(Map<String, Object> locals) {
        if (locals == null || locals.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(namespaces);
        merged.putAll(locals);
        return new ScopeStore(Collections.unmodifiableMap(merged));
    }

    public boolean has(String path) {
        return lookup(path).found();
    }

    /**
     * Value at a dot path such as {@code orders.0.total}, or null when absent.
     * Use {@link #has(String)} to tell a stored null from a missing path.
     */
    public Object get(String path) {
        return lookup(path).value();
    }

    public Set<String> namespaceNames() {
        return namespaces.keySet();
    }

    private Lookup lookup(String path) {
        if (path == null || path.isBlank()) {
            return Lookup.MISSING;
        }
        String[] segments = path.trim().split("\\.");
        if (!namespaces.containsKey(segments[0])) {
            return Lookup.MISSING;
        }
        Object current = namespaces.get(segments[0]);
        for (int i = 1; i < segments.length; i++) {
            String segment = segments[i];
            if (current instanceof Map<?, ?> map) {
                if (!map.containsKey(segment)) {
                    return Lookup.MISSING;
                }
                current = map.get(segment);
            } else if (current instanceof List<?> list) {
                int index = parseIndex(segment);
                if (index < 0 || index >= list.size()) {
                    return Lookup.MISSING;
                }
                current = list.get(index);
            } else {
                return Lookup.MISSING;
            }
        }
        return new Lookup(true, current);
    }

    private static int parseIndex(String segment) {
        try {
            return Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    @Override
    public String toString() {
        return "ScopeStore" + namespaces.keySet();
    }

    private record Lookup(boolean found, Object value) {
        static final Lookup MISSING = new Lookup(false, null);
    }
}
