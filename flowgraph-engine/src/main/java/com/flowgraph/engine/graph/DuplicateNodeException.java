package com.flowgraph.engine.graph;

/** A node with the same name is already part of the graph. */
public final class DuplicateNodeException extends GraphStructureException {

    public DuplicateNodeException(String graphName, String nodeName) {
        super(nodeName, "Node '" + nodeName + "' already exists in pipeline '" + graphName + "'");
    }
}
