/**
 * Task nodes and their bodies.
 * <ul>
 *   <li>{@link com.flowgraph.engine.task.TaskNode} – name, body, fixed inputs, description and per-run state</li>
 *   <li>{@link com.flowgraph.engine.task.TaskBody} – declared parameters plus invocation; lambda form via {@link com.flowgraph.engine.task.TaskCallable}</li>
 *   <li>{@link com.flowgraph.engine.task.MethodTaskBody} – reflection over an ordinary Java method</li>
 * </ul>
 */
package com.flowgraph.engine.task;
