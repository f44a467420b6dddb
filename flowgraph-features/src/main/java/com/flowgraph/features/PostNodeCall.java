package com.flowgraph.features;

/**
 * Contract for feature logic that runs after a task node reached a terminal state.
 * Use {@link NodeCallContext#isExecutionSucceeded()} to tell success from failure.
 *
 * @see FeatureRegistry
 */
@FunctionalInterface
public interface PostNodeCall {

    /**
     * Called after the node succeeded or failed.
     *
     * @param context node context including status, execution time and error message
     */
    void after(NodeCallContext context);
}
