package com.flowgraph.engine.report;

/**
 * Overall outcome of a run: failed if any node failed, succeeded otherwise.
 */
public enum RunStatus {
    SUCCEEDED("succeeded"),
    FAILED("failed");

    private final String value;

    RunStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
