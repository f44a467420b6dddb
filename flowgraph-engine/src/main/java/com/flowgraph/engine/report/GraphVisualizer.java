package com.flowgraph.engine.report;

import com.flowgraph.engine.graph.TaskGraph;
import com.flowgraph.engine.task.NodeStatus;
import com.flowgraph.engine.task.TaskNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Plain-text rendering of a graph's edge structure: a header, then one tree per start node.
 * A start node prints its bare name; a node at depth d prints {@code "  " * d + "└─ " + name}.
 * A node reached by several paths is printed once per path. A node already on the current path
 * is printed with {@value #CYCLE_MARKER} and not expanded further. Nodes that are not pending
 * carry their last run status, e.g. {@code "  └─ Transform [succeeded]"}.
 */
public final class GraphVisualizer {

    public static final String CONNECTOR = "└─ ";
    public static final String CYCLE_MARKER = " (cycle)";

    private GraphVisualizer() {
    }

    public static String visualize(TaskGraph graph) {
        List<String> lines = new ArrayList<>();
        lines.add("Pipeline: " + graph.getName());
        if (!graph.getDescription().isBlank()) {
            lines.add("Description: " + graph.getDescription());
        }
        lines.add("Flow:");
        List<String> starts = graph.getStartNodes();
        if (starts.isEmpty()) {
            lines.add("Empty pipeline");
        }
        for (String start : starts) {
            render(graph, start, 0, new LinkedHashSet<>(), lines);
        }
        return String.join("\n", lines);
    }

    private static void render(TaskGraph graph, String name, int depth, Set<String> path, List<String> lines) {
        StringBuilder line = new StringBuilder();
        if (depth > 0) {
            line.append("  ".repeat(depth)).append(CONNECTOR);
        }
        line.append(name);
        TaskNode node = graph.getNode(name);
        if (node != null && node.getStatus() != NodeStatus.PENDING) {
            line.append(" [").append(node.getStatus().getValue()).append(']');
        }
        if (path.contains(name)) {
            lines.add(line.append(CYCLE_MARKER).toString());
            return;
        }
        lines.add(line.toString());
        path.add(name);
        for (String next : graph.successors(name)) {
            render(graph, next, depth + 1, path, lines);
        }
        path.remove(name);
    }
}
