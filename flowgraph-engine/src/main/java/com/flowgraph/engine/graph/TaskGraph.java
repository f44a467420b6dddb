package com.flowgraph.engine.graph;

import com.flowgraph.engine.execution.ExecutionOptions;
import com.flowgraph.engine.execution.GraphExecutor;
import com.flowgraph.engine.report.GraphExporter;
import com.flowgraph.engine.report.GraphVisualizer;
import com.flowgraph.engine.report.RunReport;
import com.flowgraph.engine.task.TaskNode;
import com.flowgraph.executiontree.PipelineStructureJson;
import com.flowgraph.executiontree.structure.PipelineStructure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named directed graph of task nodes. Edges are kept per source node in insertion order;
 * duplicate edges are allowed and cycles are not rejected (a run visits every node at most once).
 * Start nodes run in the order they were marked.
 * <p>
 * Build calls validate eagerly and leave the graph untouched when they throw. Nodes keep the run
 * state of the most recent run, so a graph runs on one thread at a time.
 */
public final class TaskGraph {

    private static final Logger log = LoggerFactory.getLogger(TaskGraph.class);

    private final String name;
    private final String description;
    private final Map<String, TaskNode> nodes = new LinkedHashMap<>();
    private final Map<String, List<String>> edges = new LinkedHashMap<>();
    private final List<String> startNodes = new ArrayList<>();

    public TaskGraph(String name) {
        this(name, null);
    }

    public TaskGraph(String name, String description) {
        this.name = Objects.requireNonNull(name, "name");
        this.description = description != null ? description : "";
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Adds a node that is not a start node. */
    public TaskGraph addNode(TaskNode node) {
        return addNode(node, false);
    }

    /**
     * Adds a node; when {@code isStart} it is appended to the start nodes.
     *
     * @throws DuplicateNodeException if a node with the same name exists
     */
    public TaskGraph addNode(TaskNode node, boolean isStart) {
        Objects.requireNonNull(node, "node");
        if (nodes.containsKey(node.getName())) {
            throw new DuplicateNodeException(name, node.getName());
        }
        nodes.put(node.getName(), node);
        edges.put(node.getName(), new ArrayList<>());
        if (isStart) {
            startNodes.add(node.getName());
        }
        if (log.isDebugEnabled()) {
            log.debug("Graph addNode | pipeline={} | node={} | start={}", name, node.getName(), isStart);
        }
        return this;
    }

    /**
     * Appends an existing node to the start nodes. No-op if it is already a start node.
     *
     * @throws UnknownNodeException if no node has that name
     */
    public TaskGraph markStart(String nodeName) {
        requireNode(nodeName);
        if (!startNodes.contains(nodeName)) {
            startNodes.add(nodeName);
        }
        return this;
    }

    /**
     * Adds the edge {@code from -> to}. Both nodes must already exist.
     *
     * @throws UnknownNodeException if either name is absent; nothing is added
     */
    public TaskGraph connect(String from, String to) {
        requireNode(from);
        requireNode(to);
        edges.get(from).add(to);
        if (log.isDebugEnabled()) {
            log.debug("Graph connect | pipeline={} | from={} | to={}", name, from, to);
        }
        return this;
    }

    private void requireNode(String nodeName) {
        if (nodeName == null || !nodes.containsKey(nodeName)) {
            throw new UnknownNodeException(name, nodeName);
        }
    }

    public boolean containsNode(String nodeName) {
        return nodeName != null && nodes.containsKey(nodeName);
    }

    /** Node by name, or null. */
    public TaskNode getNode(String nodeName) {
        return nodeName != null ? nodes.get(nodeName) : null;
    }

    /** All nodes in insertion order. */
    public List<TaskNode> getNodes() {
        return List.copyOf(nodes.values());
    }

    /** Successor names of {@code nodeName} in edge-insertion order (duplicates kept); empty if unknown. */
    public List<String> successors(String nodeName) {
        List<String> out = nodeName != null ? edges.get(nodeName) : null;
        return out != null ? Collections.unmodifiableList(out) : List.of();
    }

    /** Source name to successor names, in node insertion order. Unmodifiable snapshot. */
    public Map<String, List<String>> getEdges() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        edges.forEach((from, to) -> copy.put(from, List.copyOf(to)));
        return Collections.unmodifiableMap(copy);
    }

    public List<String> getStartNodes() {
        return List.copyOf(startNodes);
    }

    public int size() {
        return nodes.size();
    }

    /** Runs with an empty initial context and default options. */
    public RunReport execute() {
        return execute(Map.of());
    }

    public RunReport execute(Map<String, ?> initialContext) {
        return execute(initialContext, ExecutionOptions.defaults());
    }

    public RunReport execute(Map<String, ?> initialContext, boolean stopOnError) {
        return execute(initialContext, ExecutionOptions.builder().stopOnError(stopOnError).build());
    }

    public RunReport execute(Map<String, ?> initialContext, ExecutionOptions options) {
        return new GraphExecutor(options).execute(this, initialContext);
    }

    /** Text tree of the edge structure, one tree per start node. */
    public String visualize() {
        return GraphVisualizer.visualize(this);
    }

    /** Structural description of this graph; bodies are not included. */
    public PipelineStructure export() {
        return GraphExporter.export(this);
    }

    /** Writes {@link #export()} as JSON to {@code file}, creating parent directories. */
    public void saveStructure(Path file) {
        PipelineStructureJson.write(export(), file);
    }

    @Override
    public String toString() {
        return "TaskGraph{name=" + name + ", nodes=" + nodes.keySet() + ", startNodes=" + startNodes + "}";
    }
}
