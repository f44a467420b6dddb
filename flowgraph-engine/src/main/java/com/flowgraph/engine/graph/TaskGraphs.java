package com.flowgraph.engine.graph;

import java.util.List;

/**
 * Factory helpers for common graph shapes.
 */
public final class TaskGraphs {

    private TaskGraphs() {
    }

    /**
     * Chain of nodes: the first spec is the only start node and each spec is connected to the next.
     * An empty list yields an empty graph.
     *
     * @throws DuplicateNodeException if two specs share a name
     */
    public static TaskGraph linear(String name, String description, List<TaskSpec> specs) {
        TaskGraph graph = new TaskGraph(name, description);
        if (specs == null || specs.isEmpty()) {
            return graph;
        }
        String previous = null;
        for (TaskSpec spec : specs) {
            graph.addNode(spec.toNode(), previous == null);
            if (previous != null) {
                graph.connect(previous, spec.name());
            }
            previous = spec.name();
        }
        return graph;
    }

    public static TaskGraph linear(String name, List<TaskSpec> specs) {
        return linear(name, null, specs);
    }
}
