package com.flowgraph.engine.task;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The opaque unit of work behind a task node. The engine reads {@link #parameters()} to bind
 * arguments by name, then calls {@link #invoke(Map)} with exactly those arguments.
 *
 * @see MethodTaskBody
 */
public interface TaskBody {

    /** Declared parameters, in declaration order. */
    List<TaskParameter> parameters();

    /**
     * Runs the body.
     *
     * @param arguments one entry per declared parameter that was resolved
     * @return a {@code Map<String, ?>} of named outputs
     * @throws Exception any failure of the body; recorded on the node, never propagated out of a run
     */
    Object invoke(Map<String, Object> arguments) throws Exception;

    /** Description used when a node is created without one. */
    default String description() {
        return "";
    }

    static TaskBody of(List<TaskParameter> parameters, TaskCallable callable) {
        return new CallableTaskBody(parameters, callable);
    }

    /** Body whose parameters are all required. */
    static TaskBody of(TaskCallable callable, String... requiredParameters) {
        List<TaskParameter> params = new ArrayList<>();
        for (String name : requiredParameters) {
            params.add(TaskParameter.required(name));
        }
        return new CallableTaskBody(params, callable);
    }

    /** {@link TaskBody} backed by a declared parameter list and a {@link TaskCallable}. */
    final class CallableTaskBody implements TaskBody {

        private final List<TaskParameter> parameters;
        private final TaskCallable callable;

        CallableTaskBody(List<TaskParameter> parameters, TaskCallable callable) {
            this.parameters = parameters != null ? List.copyOf(parameters) : List.of();
            this.callable = Objects.requireNonNull(callable, "callable");
            long distinct = this.parameters.stream().map(TaskParameter::name).distinct().count();
            if (distinct != this.parameters.size()) {
                throw new IllegalArgumentException("duplicate parameter names: " + this.parameters);
            }
        }

        @Override
        public List<TaskParameter> parameters() {
            return parameters;
        }

        @Override
        public Object invoke(Map<String, Object> arguments) throws Exception {
            return callable.call(new TaskArguments(arguments));
        }
    }
}
