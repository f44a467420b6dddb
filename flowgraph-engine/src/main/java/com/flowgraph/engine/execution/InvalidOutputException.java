package com.flowgraph.engine.execution;

/**
 * The body returned something other than a mapping of string keys to values.
 */
public final class InvalidOutputException extends TaskExecutionException {

    private final String actualType;

    public InvalidOutputException(String nodeName, String actualType) {
        super(nodeName, NodeErrorKind.INVALID_OUTPUT,
                "Node '" + nodeName + "' must return a map of named outputs but returned " + actualType, null);
        this.actualType = actualType;
    }

    /** Class name of the returned value, {@code "null"}, or a description of the offending key. */
    public String getActualType() {
        return actualType;
    }
}
