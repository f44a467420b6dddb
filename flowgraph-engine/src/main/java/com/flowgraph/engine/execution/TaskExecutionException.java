package com.flowgraph.engine.execution;

import java.util.Objects;

/**
 * Node-scoped failure during a run. Recorded on the node and in the run report; the executor
 * never lets it escape {@link GraphExecutor#execute}.
 */
public abstract class TaskExecutionException extends RuntimeException {

    private final String nodeName;
    private final NodeErrorKind kind;

    protected TaskExecutionException(String nodeName, NodeErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.nodeName = nodeName;
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public String getNodeName() {
        return nodeName;
    }

    public NodeErrorKind getKind() {
        return kind;
    }
}
