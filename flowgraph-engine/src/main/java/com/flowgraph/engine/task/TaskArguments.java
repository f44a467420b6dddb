package com.flowgraph.engine.task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Bound arguments handed to a {@link TaskCallable}: exactly the parameters the body declared,
 * resolved from fixed inputs, the execution context or declared defaults.
 */
public final class TaskArguments {

    private final Map<String, Object> values;

    public TaskArguments(Map<String, Object> values) {
        this.values = values != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(values))
                : Map.of();
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        return values.get(name);
    }

    public String getString(String name) {
        Object v = values.get(name);
        return v != null ? v.toString() : null;
    }

    /** Numeric argument as int. Throws {@link IllegalArgumentException} when absent or not a number. */
    public int getInt(String name) {
        Object v = values.get(name);
        if (v instanceof String s) {
            return parse(name, s, Integer::parseInt);
        }
        return number(name).intValue();
    }

    /** Numeric argument as long; strings must hold an integral value. */
    public long getLong(String name) {
        Object v = values.get(name);
        if (v instanceof String s) {
            return parse(name, s, Long::parseLong);
        }
        return number(name).longValue();
    }

    public double getDouble(String name) {
        Object v = values.get(name);
        if (v instanceof String s) {
            return parse(name, s, Double::parseDouble);
        }
        return number(name).doubleValue();
    }

    public boolean getBoolean(String name) {
        Object v = values.get(name);
        if (v instanceof Boolean b) return b;
        if (v instanceof String s) return Boolean.parseBoolean(s.trim());
        throw new IllegalArgumentException("Argument " + name + " is not a boolean: " + v);
    }

    @SuppressWarnings("unchecked")
    public <T> List<T> getList(String name) {
        Object v = values.get(name);
        if (v == null) return null;
        if (v instanceof List<?> list) return (List<T>) list;
        throw new IllegalArgumentException("Argument " + name + " is not a list: " + v.getClass().getName());
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String name, Class<T> type) {
        Object v = values.get(name);
        if (v == null) return null;
        if (!type.isInstance(v)) {
            throw new IllegalArgumentException("Argument " + name + " is " + v.getClass().getName() + ", not " + type.getName());
        }
        return (T) v;
    }

    /** Unmodifiable view of all bound arguments. */
    public Map<String, Object> asMap() {
        return values;
    }

    private Number number(String name) {
        Object v = values.get(name);
        if (v instanceof Number n) return n;
        throw new IllegalArgumentException("Argument " + name + " is not a number: " + v);
    }

    private static <N extends Number> N parse(String name, String raw, Function<String, N> parser) {
        try {
            return parser.apply(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Argument " + name + " is not a valid number: " + raw, e);
        }
    }

    @Override
    public String toString() {
        return "TaskArguments" + values;
    }
}
