package com.flowgraph.engine.task;

import com.flowgraph.engine.execution.TaskExecutionException;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One unit of work in a task graph: definition (name, body, fixed inputs, description) plus the
 * run state of the most recent execution. The definition is immutable; the run state is reset
 * at the start of every run and moves PENDING, RUNNING, then exactly one terminal status.
 */
public final class TaskNode {

    private final String name;
    private final TaskBody body;
    private final Map<String, Object> fixedInputs;
    private final String description;

    private NodeStatus status = NodeStatus.PENDING;
    private Map<String, Object> output = Map.of();
    private TaskExecutionException error;
    private Instant startedAt;
    private Instant finishedAt;
    private Duration executionTime;

    public TaskNode(String name, TaskBody body) {
        this(name, body, null, null);
    }

    public TaskNode(String name, TaskBody body, Map<String, ?> fixedInputs) {
        this(name, body, fixedInputs, null);
    }

    /**
     * @param name        unique name within a graph
     * @param body        the work to run
     * @param fixedInputs values bound before the execution context is consulted; copied
     * @param description free text; null or blank falls back to {@link TaskBody#description()}
     */
    public TaskNode(String name, TaskBody body, Map<String, ?> fixedInputs, String description) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("task node name must be non-blank");
        }
        this.name = name;
        this.body = Objects.requireNonNull(body, "body");
        this.fixedInputs = fixedInputs != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(fixedInputs))
                : Map.of();
        String fallback = body.description() != null ? body.description() : "";
        this.description = description != null && !description.isBlank() ? description : fallback;
    }

    public String getName() {
        return name;
    }

    public TaskBody getBody() {
        return body;
    }

    public Map<String, Object> getFixedInputs() {
        return fixedInputs;
    }

    public String getDescription() {
        return description;
    }

    public NodeStatus getStatus() {
        return status;
    }

    /** Output of the last successful invocation in the current run; empty otherwise. */
    public Map<String, Object> getOutput() {
        return output;
    }

    /** Failure of the current run; null unless {@link NodeStatus#FAILED}. */
    public TaskExecutionException getError() {
        return error;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    /** Time from RUNNING to the terminal status; null when the node was not attempted. */
    public Duration getExecutionTime() {
        return executionTime;
    }

    /** Back to PENDING; clears output, error and timings. */
    public void reset() {
        status = NodeStatus.PENDING;
        output = Map.of();
        error = null;
        startedAt = null;
        finishedAt = null;
        executionTime = null;
    }

    public void markRunning(Instant at) {
        requireStatus(NodeStatus.PENDING, NodeStatus.RUNNING);
        status = NodeStatus.RUNNING;
        startedAt = at;
    }

    public void markSucceeded(Map<String, Object> result, Instant at, Duration elapsed) {
        requireStatus(NodeStatus.RUNNING, NodeStatus.SUCCEEDED);
        status = NodeStatus.SUCCEEDED;
        output = result != null ? Collections.unmodifiableMap(new LinkedHashMap<>(result)) : Map.of();
        finishedAt = at;
        executionTime = elapsed;
    }

    public void markFailed(TaskExecutionException failure, Instant at, Duration elapsed) {
        requireStatus(NodeStatus.RUNNING, NodeStatus.FAILED);
        status = NodeStatus.FAILED;
        error = Objects.requireNonNull(failure, "failure");
        finishedAt = at;
        executionTime = elapsed;
    }

    public void markSkipped() {
        requireStatus(NodeStatus.PENDING, NodeStatus.SKIPPED);
        status = NodeStatus.SKIPPED;
    }

    private void requireStatus(NodeStatus expected, NodeStatus target) {
        if (status != expected) {
            throw new IllegalStateException("Node " + name + " cannot move from " + status + " to " + target);
        }
    }

    @Override
    public String toString() {
        return "TaskNode{name=" + name + ", status=" + status + "}";
    }
}
