package com.flowgraph.engine.report;

import com.flowgraph.engine.graph.TaskGraph;
import com.flowgraph.engine.task.TaskBody;
import com.flowgraph.engine.task.TaskNode;
import com.flowgraph.executiontree.structure.EdgeStructure;
import com.flowgraph.executiontree.structure.NodeStructure;
import com.flowgraph.executiontree.structure.PipelineStructure;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts between a {@link TaskGraph} and its structural description. The structure never
 * carries task bodies; {@link #rebuild} needs the caller to supply one per node.
 */
public final class GraphExporter {

    private GraphExporter() {
    }

    public static PipelineStructure export(TaskGraph graph) {
        List<NodeStructure> nodes = new ArrayList<>();
        List<EdgeStructure> edges = new ArrayList<>();
        for (TaskNode node : graph.getNodes()) {
            nodes.add(new NodeStructure(node.getName(), node.getDescription(), node.getFixedInputs()));
            for (String to : graph.successors(node.getName())) {
                edges.add(new EdgeStructure(node.getName(), to));
            }
        }
        return new PipelineStructure(graph.getName(), graph.getDescription(), nodes, edges, graph.getStartNodes());
    }

    /**
     * Executable graph from a structure plus bodies keyed by node name.
     *
     * @throws IllegalArgumentException naming the first node without a body
     * @throws com.flowgraph.engine.graph.GraphStructureException if the structure itself is inconsistent
     */
    public static TaskGraph rebuild(PipelineStructure structure, Map<String, ? extends TaskBody> bodies) {
        Objects.requireNonNull(structure, "structure");
        Map<String, ? extends TaskBody> available = bodies != null ? bodies : Map.of();
        TaskGraph graph = new TaskGraph(structure.getPipelineName(), structure.getDescription());
        for (NodeStructure n : structure.getNodes()) {
            TaskBody body = available.get(n.getName());
            if (body == null) {
                throw new IllegalArgumentException("No task body supplied for node: " + n.getName());
            }
            graph.addNode(new TaskNode(n.getName(), body, n.getFixedInputs(), n.getDescription()));
        }
        for (String start : structure.getStartNodes()) {
            graph.markStart(start);
        }
        for (EdgeStructure e : structure.getEdges()) {
            graph.connect(e.getFrom(), e.getTo());
        }
        return graph;
    }
}
