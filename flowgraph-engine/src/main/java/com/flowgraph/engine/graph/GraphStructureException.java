package com.flowgraph.engine.graph;

/**
 * Thrown by a graph build call ({@code addNode}, {@code connect}) that would produce an invalid
 * graph. The graph is left unchanged.
 */
public class GraphStructureException extends IllegalArgumentException {

    private final String nodeName;

    public GraphStructureException(String nodeName, String message) {
        super(message);
        this.nodeName = nodeName;
    }

    public String getNodeName() {
        return nodeName;
    }
}
