package com.flowgraph.executioncontext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Single responsibility: the key/value store accumulated across one run.
 * Seeded from the caller's initial values (copied, never aliased), then merged with every
 * successful node's output; later keys overwrite earlier ones. Insertion-ordered.
 * <p>
 * Not thread-safe: a run is driven by exactly one thread. Null values are stored as a sentinel
 * so that "key present with null value" stays distinguishable from "key absent" for binding.
 */
public final class ExecutionContext {

    /** Sentinel for null values; keeps key presence explicit. */
    private static final Object NULL = new Object();

    private final Map<String, Object> values = new LinkedHashMap<>();

    private ExecutionContext() {
    }

    /** Empty context. */
    public static ExecutionContext empty() {
        return new ExecutionContext();
    }

    /** Context seeded with a copy of {@code initialValues} (null = empty). Null keys are ignored. */
    public static ExecutionContext seededWith(Map<String, ?> initialValues) {
        ExecutionContext context = new ExecutionContext();
        context.merge(initialValues);
        return context;
    }

    /** True if the key is present, even when its value is null. */
    public boolean contains(String key) {
        return key != null && values.containsKey(key);
    }

    public Object get(String key) {
        Object v = values.get(key);
        return v == NULL ? null : v;
    }

    public void put(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("context key must not be null");
        }
        values.put(key, value != null ? value : NULL);
    }

    /** Merges all entries (later key wins on collision). Null map is a no-op. */
    public void merge(Map<String, ?> entries) {
        if (entries == null) return;
        for (Map.Entry<String, ?> e : entries.entrySet()) {
            if (e.getKey() != null) {
                put(e.getKey(), e.getValue());
            }
        }
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public int size() {
        return values.size();
    }

    /**
     * Independent copy of the current values (sentinel converted back to null).
     * Later mutations of this context do not affect the returned map.
     */
    public Map<String, Object> snapshot() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : values.entrySet()) {
            out.put(e.getKey(), e.getValue() == NULL ? null : e.getValue());
        }
        return out;
    }

    @Override
    public String toString() {
        return "ExecutionContext" + snapshot();
    }
}
