package com.flowgraph.engine.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowgraph.engine.execution.ExecutionOptions;
import com.flowgraph.engine.graph.TaskGraph;
import com.flowgraph.engine.task.TaskBody;
import com.flowgraph.engine.task.TaskNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunReportJsonTest {

    @Test
    void rendersReportSchema() throws Exception {
        Instant stamp = Instant.parse("2024-05-01T10:15:30Z");
        TaskGraph graph = new TaskGraph("Json")
                .addNode(new TaskNode("A", TaskBody.of(args -> Map.of("x", 1, "when", stamp))), true)
                .addNode(new TaskNode("B", TaskBody.of(args -> Map.of(), "missing")))
                .addNode(new TaskNode("C", TaskBody.of(args -> Map.of())))
                .connect("A", "B")
                .connect("B", "C");
        RunReport report = graph.execute(Map.of(), ExecutionOptions.builder().logSummary(false).build());

        JsonNode json = new ObjectMapper().readTree(RunReportJson.toJson(report));

        assertEquals("Json", json.get("pipelineName").asText());
        assertEquals("failed", json.get("status").asText());
        assertTrue(json.get("totalTime").isNumber());
        assertEquals("succeeded", json.at("/nodes/A/status").asText());
        assertEquals(1, json.at("/nodes/A/output/x").asInt());
        assertEquals("MissingInput", json.at("/nodes/B/errorKind").asText());
        assertTrue(json.at("/nodes/B/error").asText().contains("missing"));
        assertEquals("skipped", json.at("/nodes/C/status").asText());
        assertTrue(json.at("/nodes/C/executionTime").isNull());
        assertEquals(stamp.toString(), json.at("/finalContext/when").asText());
        assertEquals(2, json.get("executionLog").size());
        assertEquals("B", json.at("/executionLog/1/node").asText());
        assertTrue(Instant.parse(json.at("/executionLog/0/startedAt").asText()).isBefore(Instant.now().plusSeconds(1)));
    }
}
