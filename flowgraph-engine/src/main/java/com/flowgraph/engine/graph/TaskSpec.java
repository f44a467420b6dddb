package com.flowgraph.engine.graph;

import com.flowgraph.engine.task.TaskBody;
import com.flowgraph.engine.task.TaskNode;

import java.util.Map;
import java.util.Objects;

/**
 * One entry of a linear chain: everything needed to create a {@link TaskNode}.
 */
public record TaskSpec(String name, TaskBody body, Map<String, ?> fixedInputs, String description) {

    public TaskSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
    }

    public static TaskSpec of(String name, TaskBody body) {
        return new TaskSpec(name, body, null, null);
    }

    public static TaskSpec of(String name, TaskBody body, String description) {
        return new TaskSpec(name, body, null, description);
    }

    public TaskNode toNode() {
        return new TaskNode(name, body, fixedInputs, description);
    }
}
