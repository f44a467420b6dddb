package com.flowgraph.engine.execution;

/**
 * A required parameter was found in neither fixed inputs nor the execution context and has no default.
 * The body is never invoked.
 */
public final class MissingInputException extends TaskExecutionException {

    private final String parameterName;

    public MissingInputException(String nodeName, String parameterName) {
        super(nodeName, NodeErrorKind.MISSING_INPUT,
                "Missing input '" + parameterName + "' for node '" + nodeName + "'", null);
        this.parameterName = parameterName;
    }

    public String getParameterName() {
        return parameterName;
    }
}
