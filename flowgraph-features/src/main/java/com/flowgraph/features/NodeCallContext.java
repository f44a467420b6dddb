package com.flowgraph.features;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Context passed to feature hooks when a task node is about to run (pre) or has just finished (post).
 * Outcome fields (status, execution time, error, output) are only set for the post phase:
 * use {@link #withOutcome} to derive the post context from the pre context.
 */
public final class NodeCallContext {

    private final String pipelineName;
    private final String nodeName;
    private final String description;
    private final String status;
    private final Duration executionTime;
    private final String errorMessage;
    private final Map<String, Object> output;
    /** True = succeeded, false = failed, null = pre phase. */
    private final Boolean executionSucceeded;

    public NodeCallContext(String pipelineName, String nodeName, String description) {
        this(pipelineName, nodeName, description, "running", null, null, null, null);
    }

    private NodeCallContext(String pipelineName, String nodeName, String description, String status,
                            Duration executionTime, String errorMessage, Map<String, Object> output,
                            Boolean executionSucceeded) {
        this.pipelineName = pipelineName != null ? pipelineName : "";
        this.nodeName = Objects.requireNonNull(nodeName, "nodeName");
        this.description = description != null ? description : "";
        this.status = status;
        this.executionTime = executionTime;
        this.errorMessage = errorMessage;
        this.output = output != null ? Collections.unmodifiableMap(new LinkedHashMap<>(output)) : Map.of();
        this.executionSucceeded = executionSucceeded;
    }

    /** Returns a new context carrying the node outcome (for the post phase). */
    public NodeCallContext withOutcome(String status, boolean succeeded, Duration executionTime,
                                       String errorMessage, Map<String, Object> output) {
        return new NodeCallContext(pipelineName, nodeName, description, status, executionTime,
                errorMessage, output, succeeded);
    }

    public String getPipelineName() {
        return pipelineName;
    }

    public String getNodeName() {
        return nodeName;
    }

    public String getDescription() {
        return description;
    }

    /** Node status value (e.g. running, succeeded, failed). */
    public String getStatus() {
        return status;
    }

    /** Time spent binding and invoking the node; null in the pre phase. */
    public Duration getExecutionTime() {
        return executionTime;
    }

    /** Error message when the node failed; null otherwise. */
    public String getErrorMessage() {
        return errorMessage;
    }

    /** Output of a succeeded node. Unmodifiable; empty otherwise. */
    public Map<String, Object> getOutput() {
        return output;
    }

    /** True for a succeeded node, false for a failed one, null in the pre phase. */
    public Boolean getExecutionSucceeded() {
        return executionSucceeded;
    }

    public boolean isExecutionSucceeded() {
        return Boolean.TRUE.equals(executionSucceeded);
    }
}
