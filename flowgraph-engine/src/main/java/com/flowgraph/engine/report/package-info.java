/**
 * Run reports and static graph output: {@link com.flowgraph.engine.report.RunReport} (+ JSON),
 * {@link com.flowgraph.engine.report.GraphVisualizer}, {@link com.flowgraph.engine.report.GraphExporter}
 * and the logged run summary.
 */
package com.flowgraph.engine.report;
