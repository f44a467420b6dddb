/**
 * Run-time engine: {@link com.flowgraph.engine.execution.GraphExecutor} (traversal and error policy),
 * {@link com.flowgraph.engine.execution.ParameterBinder} (binding by name),
 * {@link com.flowgraph.engine.execution.NodeInvoker} (invocation and output validation) and the
 * node-scoped failures derived from {@link com.flowgraph.engine.execution.TaskExecutionException}.
 */
package com.flowgraph.engine.execution;
