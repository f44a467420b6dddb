package com.flowgraph.features;

/**
 * Contract for feature logic that runs before a task node's inputs are bound and its body invoked.
 * Implement this (and optionally {@link PostNodeCall}) and annotate the class with {@link com.flowgraph.annotations.FlowFeature}.
 */
@FunctionalInterface
public interface PreNodeCall {

    /**
     * Called when the node has been marked running.
     *
     * @param context node context (pipeline, node name, description)
     */
    void before(NodeCallContext context);
}
