package com.flowgraph.engine.execution;

/**
 * The task body threw. The original failure is the cause.
 */
public final class TaskBodyException extends TaskExecutionException {

    public TaskBodyException(String nodeName, Throwable cause) {
        super(nodeName, NodeErrorKind.BODY_ERROR, "Node '" + nodeName + "' failed: " + describe(cause), cause);
    }

    private static String describe(Throwable cause) {
        String msg = cause.getMessage();
        return msg != null && !msg.isBlank() ? msg : cause.getClass().getName();
    }
}
