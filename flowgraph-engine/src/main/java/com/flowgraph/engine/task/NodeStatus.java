package com.flowgraph.engine.task;

/**
 * Run status of a task node. Every node starts {@link #PENDING} and reaches exactly one of
 * {@link #SUCCEEDED}, {@link #FAILED} or {@link #SKIPPED} per run.
 */
public enum NodeStatus {
    /** Not yet visited in the current run. */
    PENDING("pending"),
    /** Inputs are being bound or the body is executing. */
    RUNNING("running"),
    /** Body returned a valid output mapping that was merged into the context. */
    SUCCEEDED("succeeded"),
    /** Missing input, invalid output, or the body threw. */
    FAILED("failed"),
    /** Never attempted: unreachable, or the run halted before it was reached. */
    SKIPPED("skipped");

    private final String value;

    NodeStatus(String value) {
        this.value = value;
    }

    /** Lower-case wire value used in reports, logs and visualization. */
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }

    @Override
    public String toString() {
        return value;
    }
}
