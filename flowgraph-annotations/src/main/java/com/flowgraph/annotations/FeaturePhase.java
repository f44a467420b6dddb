package com.flowgraph.annotations;

/**
 * When a feature is invoked relative to node execution.
 */
public enum FeaturePhase {
    /** Invoked before the node body is bound and invoked. */
    PRE,
    /** Invoked after the node reaches a terminal state (success or failure). */
    POST,
    /** Invoked before the node and again after. */
    PRE_POST;

    public boolean includesPre() {
        return this == PRE || this == PRE_POST;
    }

    public boolean includesPost() {
        return this == POST || this == PRE_POST;
    }
}
