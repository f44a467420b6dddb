package com.flowgraph.engine.task;

/**
 * Lambda form of a task body. Must return a {@code Map<String, ?>} of named outputs;
 * any other result fails the node with an invalid-output error.
 */
@FunctionalInterface
public interface TaskCallable {

    Object call(TaskArguments arguments) throws Exception;
}
