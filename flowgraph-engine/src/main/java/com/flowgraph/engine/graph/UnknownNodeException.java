package com.flowgraph.engine.graph;

/** An edge or start marker refers to a node name the graph does not contain. */
public final class UnknownNodeException extends GraphStructureException {

    public UnknownNodeException(String graphName, String nodeName) {
        super(nodeName, "Node '" + nodeName + "' not found in pipeline '" + graphName + "'");
    }
}
