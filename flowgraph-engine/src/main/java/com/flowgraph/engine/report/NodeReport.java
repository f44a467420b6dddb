package com.flowgraph.engine.report;

import com.flowgraph.engine.execution.NodeErrorKind;
import com.flowgraph.engine.execution.TaskExecutionException;
import com.flowgraph.engine.task.NodeStatus;
import com.flowgraph.engine.task.TaskNode;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Terminal state of one node at the end of a run.
 *
 * @param executionTime null for skipped nodes
 * @param error         error message; null unless failed
 * @param errorKind     null unless failed
 * @param output        output of a succeeded node; empty otherwise
 */
public record NodeReport(NodeStatus status, Duration executionTime, String error, NodeErrorKind errorKind,
                         Map<String, Object> output) {

    public NodeReport {
        output = output != null ? Collections.unmodifiableMap(new LinkedHashMap<>(output)) : Map.of();
    }

    /** Snapshot of the node's current run state. */
    public static NodeReport of(TaskNode node) {
        TaskExecutionException err = node.getError();
        return new NodeReport(node.getStatus(), node.getExecutionTime(),
                err != null ? err.getMessage() : null,
                err != null ? err.getKind() : null,
                node.getOutput());
    }
}
