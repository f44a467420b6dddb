package com.flowgraph.engine.execution;

/**
 * Category of a node-scoped run failure.
 */
public enum NodeErrorKind {
    MISSING_INPUT("MissingInput"),
    INVALID_OUTPUT("InvalidOutput"),
    BODY_ERROR("BodyError");

    private final String label;

    NodeErrorKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
