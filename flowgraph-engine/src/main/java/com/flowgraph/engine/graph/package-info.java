/**
 * Graph construction: {@link com.flowgraph.engine.graph.TaskGraph} with eager structural
 * validation, and {@link com.flowgraph.engine.graph.TaskGraphs#linear} for chains.
 */
package com.flowgraph.engine.graph;
