package com.flowgraph.engine.report;

import com.flowgraph.engine.task.NodeStatus;

import java.time.Instant;

/**
 * One attempted node, in invocation order.
 */
public record ExecutionLogEntry(String nodeName, Instant startedAt, Instant finishedAt, NodeStatus status) {
}
