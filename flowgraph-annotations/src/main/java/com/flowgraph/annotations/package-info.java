/**
 * FlowGraph annotations.
 * <ul>
 *   <li>{@link com.flowgraph.annotations.TaskFunction} / {@link com.flowgraph.annotations.TaskInput} – turn a plain Java method into a task body bound by parameter name</li>
 *   <li>{@link com.flowgraph.annotations.FlowFeature} – feature (name, phase) observing node execution</li>
 * </ul>
 */
package com.flowgraph.annotations;
