package com.flowgraph.engine.task;

import java.util.Objects;

/**
 * A named parameter declared by a task body. Optional parameters carry the default that is
 * used when neither the node's fixed inputs nor the execution context supply a value.
 */
public record TaskParameter(String name, boolean required, Object defaultValue) {

    public TaskParameter {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("parameter name must be non-blank");
        }
        if (required && defaultValue != null) {
            throw new IllegalArgumentException("required parameter cannot declare a default: " + name);
        }
    }

    public static TaskParameter required(String name) {
        return new TaskParameter(name, true, null);
    }

    public static TaskParameter optional(String name, Object defaultValue) {
        return new TaskParameter(name, false, defaultValue);
    }
}
