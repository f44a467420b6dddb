package com.flowgraph.engine.report;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one run. Immutable and independent of later runs of the same graph.
 */
public final class RunReport {

    private final String pipelineName;
    private final RunStatus status;
    private final Duration totalTime;
    private final Map<String, NodeReport> nodes;
    private final Map<String, Object> finalContext;
    private final List<ExecutionLogEntry> executionLog;

    public RunReport(String pipelineName, RunStatus status, Duration totalTime, Map<String, NodeReport> nodes,
                     Map<String, Object> finalContext, List<ExecutionLogEntry> executionLog) {
        this.pipelineName = pipelineName;
        this.status = Objects.requireNonNull(status, "status");
        this.totalTime = totalTime != null ? totalTime : Duration.ZERO;
        this.nodes = nodes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(nodes)) : Map.of();
        this.finalContext = finalContext != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(finalContext))
                : Map.of();
        this.executionLog = executionLog != null ? List.copyOf(executionLog) : List.of();
    }

    public String getPipelineName() {
        return pipelineName;
    }

    public RunStatus getStatus() {
        return status;
    }

    public boolean isSucceeded() {
        return status == RunStatus.SUCCEEDED;
    }

    public Duration getTotalTime() {
        return totalTime;
    }

    /** Node name to report, in graph insertion order. */
    public Map<String, NodeReport> getNodes() {
        return nodes;
    }

    public NodeReport getNode(String name) {
        return nodes.get(name);
    }

    /** Context at the end of the run (values may be null). */
    public Map<String, Object> getFinalContext() {
        return finalContext;
    }

    public List<ExecutionLogEntry> getExecutionLog() {
        return executionLog;
    }

    /** Names of attempted nodes in invocation order. */
    public List<String> getExecutionOrder() {
        return executionLog.stream().map(ExecutionLogEntry::nodeName).toList();
    }

    @Override
    public String toString() {
        return "RunReport{pipeline=" + pipelineName + ", status=" + status + ", totalTime=" + totalTime
                + ", order=" + getExecutionOrder() + "}";
    }
}
