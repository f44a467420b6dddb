package com.flowgraph.engine.execution;

import com.flowgraph.engine.task.TaskNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single responsibility: call a node's body with bound arguments and validate that the result
 * is a mapping of named outputs.
 */
public final class NodeInvoker {

    /**
     * @return the output mapping (copy, string keys, insertion order kept)
     * @throws TaskBodyException      if the body threw an exception or an error other than a
     *                                {@link VirtualMachineError} (a stack overflow is still wrapped)
     * @throws InvalidOutputException if the body returned null, a non-map, or a map with a non-string key
     */
    public Map<String, Object> invoke(TaskNode node, Map<String, Object> arguments) {
        Object result;
        try {
            result = node.getBody().invoke(arguments);
        } catch (Exception | StackOverflowError e) {
            throw new TaskBodyException(node.getName(), e);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Error e) {
            // assertion and linkage failures belong to the node, not the run
            throw new TaskBodyException(node.getName(), e);
        }
        if (!(result instanceof Map<?, ?> map)) {
            throw new InvalidOutputException(node.getName(), result == null ? "null" : result.getClass().getName());
        }
        Map<String, Object> output = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (!(e.getKey() instanceof String key)) {
                Object k = e.getKey();
                throw new InvalidOutputException(node.getName(),
                        "a map with key of type " + (k == null ? "null" : k.getClass().getName()));
            }
            output.put(key, e.getValue());
        }
        return output;
    }
}
