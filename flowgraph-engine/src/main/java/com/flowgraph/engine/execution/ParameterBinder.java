package com.flowgraph.engine.execution;

import com.flowgraph.engine.task.TaskNode;
import com.flowgraph.engine.task.TaskParameter;
import com.flowgraph.executioncontext.ExecutionContext;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single responsibility: resolve a node's declared parameters by name.
 * Per parameter: fixed inputs, then the execution context, then the declared default.
 * Keys the body did not declare are never passed.
 */
public final class ParameterBinder {

    /**
     * @return argument name to value for every resolved parameter, in declaration order
     * @throws MissingInputException for the first required parameter that cannot be resolved
     */
    public Map<String, Object> bind(TaskNode node, ExecutionContext context) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        Map<String, Object> fixed = node.getFixedInputs();
        for (TaskParameter param : node.getBody().parameters()) {
            String name = param.name();
            if (fixed.containsKey(name)) {
                arguments.put(name, fixed.get(name));
            } else if (context.contains(name)) {
                arguments.put(name, context.get(name));
            } else if (!param.required()) {
                arguments.put(name, param.defaultValue());
            } else {
                throw new MissingInputException(node.getName(), name);
            }
        }
        return arguments;
    }
}
