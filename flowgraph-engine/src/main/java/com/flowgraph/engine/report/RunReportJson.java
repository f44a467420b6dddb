package com.flowgraph.engine.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Renders a {@link RunReport} as JSON. Durations are seconds (decimal), timestamps ISO-8601.
 * Context and output values that Jackson cannot serialize are rendered with {@code toString()}.
 */
public final class RunReportJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private RunReportJson() {
    }

    public static String toJson(RunReport report) {
        try {
            return MAPPER.writeValueAsString(toTree(report));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String toJsonPretty(RunReport report) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(report));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ObjectNode toTree(RunReport report) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("pipelineName", report.getPipelineName());
        root.put("status", report.getStatus().getValue());
        root.put("totalTime", seconds(report.getTotalTime()));

        ObjectNode nodes = root.putObject("nodes");
        for (Map.Entry<String, NodeReport> e : report.getNodes().entrySet()) {
            NodeReport n = e.getValue();
            ObjectNode node = nodes.putObject(e.getKey());
            node.put("status", n.status().getValue());
            if (n.executionTime() != null) {
                node.put("executionTime", seconds(n.executionTime()));
            } else {
                node.putNull("executionTime");
            }
            node.put("error", n.error());
            node.put("errorKind", n.errorKind() != null ? n.errorKind().getLabel() : null);
            node.set("output", values(n.output()));
        }

        root.set("finalContext", values(report.getFinalContext()));

        ArrayNode log = root.putArray("executionLog");
        for (ExecutionLogEntry entry : report.getExecutionLog()) {
            ObjectNode item = log.addObject();
            item.put("node", entry.nodeName());
            item.put("startedAt", iso(entry.startedAt()));
            item.put("finishedAt", iso(entry.finishedAt()));
            item.put("status", entry.status().getValue());
        }
        return root;
    }

    private static ObjectNode values(Map<String, Object> map) {
        ObjectNode out = MAPPER.createObjectNode();
        for (Map.Entry<String, Object> e : map.entrySet()) {
            out.set(e.getKey(), value(e.getValue()));
        }
        return out;
    }

    private static JsonNode value(Object v) {
        if (v == null) {
            return NullNode.getInstance();
        }
        try {
            return MAPPER.valueToTree(v);
        } catch (IllegalArgumentException e) {
            // not serializable as a bean (e.g. java.time without the JSR-310 module)
            return TextNode.valueOf(String.valueOf(v));
        }
    }

    private static double seconds(Duration d) {
        return d.toNanos() / 1_000_000_000.0;
    }

    private static String iso(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
