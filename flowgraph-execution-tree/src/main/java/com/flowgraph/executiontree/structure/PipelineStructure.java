package com.flowgraph.executiontree.structure;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structural document of a pipeline: name, description, nodes (name, description, fixed inputs),
 * edges in insertion order and start node names in the order they were marked.
 * Export-only: it describes graph shape and carries no executable behavior.
 */
public final class PipelineStructure {

    private final String pipelineName;
    private final String description;
    private final List<NodeStructure> nodes;
    private final List<EdgeStructure> edges;
    private final List<String> startNodes;

    @JsonCreator
    public PipelineStructure(
            @JsonProperty("pipelineName") String pipelineName,
            @JsonProperty("description") String description,
            @JsonProperty("nodes") List<NodeStructure> nodes,
            @JsonProperty("edges") List<EdgeStructure> edges,
            @JsonProperty("startNodes") List<String> startNodes) {
        this.pipelineName = pipelineName;
        this.description = description != null ? description : "";
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
        this.edges = edges != null ? List.copyOf(edges) : List.of();
        this.startNodes = startNodes != null ? List.copyOf(startNodes) : List.of();
    }

    public String getPipelineName() {
        return pipelineName;
    }

    public String getDescription() {
        return description;
    }

    public List<NodeStructure> getNodes() {
        return nodes;
    }

    public List<EdgeStructure> getEdges() {
        return edges;
    }

    public List<String> getStartNodes() {
        return startNodes;
    }

    /** Finds a node by name. Returns null if not found. */
    public NodeStructure findNode(String name) {
        if (name == null) return null;
        for (NodeStructure node : nodes) {
            if (name.equals(node.getName())) return node;
        }
        return null;
    }

    /** Successor names per node, in edge order (duplicates kept). Nodes without edges are absent. */
    public Map<String, List<String>> successorsByNode() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (EdgeStructure edge : edges) {
            out.computeIfAbsent(edge.getFrom(), k -> new ArrayList<>()).add(edge.getTo());
        }
        out.replaceAll((k, v) -> Collections.unmodifiableList(v));
        return Collections.unmodifiableMap(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PipelineStructure that = (PipelineStructure) o;
        return Objects.equals(pipelineName, that.pipelineName)
                && Objects.equals(description, that.description)
                && Objects.equals(nodes, that.nodes)
                && Objects.equals(edges, that.edges)
                && Objects.equals(startNodes, that.startNodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pipelineName, description, nodes, edges, startNodes);
    }
}
