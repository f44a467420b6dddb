package com.flowgraph.engine.execution;

import com.flowgraph.annotations.FeaturePhase;
import com.flowgraph.engine.graph.TaskGraph;
import com.flowgraph.engine.graph.TaskGraphs;
import com.flowgraph.engine.graph.TaskSpec;
import com.flowgraph.engine.report.ExecutionLogEntry;
import com.flowgraph.engine.report.RunReport;
import com.flowgraph.engine.report.RunStatus;
import com.flowgraph.engine.task.NodeStatus;
import com.flowgraph.engine.task.TaskBody;
import com.flowgraph.engine.task.TaskNode;
import com.flowgraph.engine.task.TaskParameter;
import com.flowgraph.features.FeatureRegistry;
import com.flowgraph.features.PostNodeCall;
import com.flowgraph.features.PreNodeCall;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphExecutorTest {

    private static final ExecutionOptions QUIET = ExecutionOptions.builder().logSummary(false).build();
    private static final ExecutionOptions QUIET_CONTINUE = ExecutionOptions.builder()
            .logSummary(false).stopOnError(false).build();

    private static TaskBody emit(String key, Object value) {
        return TaskBody.of(args -> Map.of(key, value));
    }

    private static TaskBody noop() {
        return TaskBody.of(args -> Map.of());
    }

    @Test
    void chain_passesOutputDownstream() {
        AtomicReference<Object> seenByC = new AtomicReference<>();
        TaskGraph graph = new TaskGraph("Chain")
                .addNode(new TaskNode("A", emit("x", 1)), true)
                .addNode(new TaskNode("B", noop()))
                .addNode(new TaskNode("C", TaskBody.of(args -> {
                    seenByC.set(args.get("x"));
                    return Map.of();
                }, "x")))
                .connect("A", "B")
                .connect("B", "C");

        RunReport report = graph.execute(Map.of(), QUIET);

        assertEquals(1, seenByC.get());
        assertEquals(RunStatus.SUCCEEDED, report.getStatus());
        assertEquals(List.of("A", "B", "C"), report.getExecutionOrder());
        assertEquals(1, report.getFinalContext().get("x"));
    }

    @Test
    void fanOut_bothBranchesSeeSameValue() {
        List<Object> seen = new ArrayList<>();
        TaskBody reader = TaskBody.of(args -> {
            seen.add(args.get("x"));
            return Map.of();
        }, "x");
        TaskGraph graph = new TaskGraph("FanOut")
                .addNode(new TaskNode("A", emit("x", 42)), true)
                .addNode(new TaskNode("B", reader))
                .addNode(new TaskNode("C", reader))
                .connect("A", "B")
                .connect("A", "C");

        RunReport report = graph.execute(Map.of(), QUIET);

        assertEquals(List.of(42, 42), seen);
        assertEquals(List.of("A", "B", "C"), report.getExecutionOrder());
    }

    @Test
    void eachNodeRunsAtMostOnce_diamondAndCycle() {
        AtomicInteger dRuns = new AtomicInteger();
        AtomicInteger aRuns = new AtomicInteger();
        TaskGraph graph = new TaskGraph("Diamond")
                .addNode(new TaskNode("A", TaskBody.of(args -> {
                    aRuns.incrementAndGet();
                    return Map.of();
                })), true)
                .addNode(new TaskNode("B", noop()))
                .addNode(new TaskNode("C", noop()))
                .addNode(new TaskNode("D", TaskBody.of(args -> {
                    dRuns.incrementAndGet();
                    return Map.of();
                })))
                .connect("A", "B")
                .connect("A", "C")
                .connect("B", "D")
                .connect("C", "D")
                .connect("D", "A")
                .connect("D", "D");

        RunReport report = graph.execute(Map.of(), QUIET);

        assertEquals(1, aRuns.get());
        assertEquals(1, dRuns.get());
        assertEquals(List.of("A", "B", "D", "C"), report.getExecutionOrder());
        assertEquals(RunStatus.SUCCEEDED, report.getStatus());
    }

    @Test
    void traversal_isDepthFirstInEdgeOrder() {
        TaskGraph graph = new TaskGraph("Depth")
                .addNode(new TaskNode("A", noop()), true)
                .addNode(new TaskNode("B", noop()))
                .addNode(new TaskNode("C", noop()))
                .addNode(new TaskNode("D", noop()))
                .addNode(new TaskNode("S2", noop()), true)
                .addNode(new TaskNode("E", noop()))
                .connect("A", "B")
                .connect("A", "C")
                .connect("B", "D")
                .connect("S2", "E")
                .connect("S2", "C");

        RunReport report = graph.execute(Map.of(), QUIET);

        assertEquals(List.of("A", "B", "D", "C", "S2", "E"), report.getExecutionOrder());
    }

    @Test
    void join_runsOnFirstArrivalWithContextSoFar() {
        AtomicInteger mergeRuns = new AtomicInteger();
        TaskGraph graph = new TaskGraph("Branching")
                .addNode(new TaskNode("Start", emit("value", 10)), true)
                .addNode(new TaskNode("Double", TaskBody.of(args -> Map.of("doubled", args.getInt("value") * 2), "value")))
                .addNode(new TaskNode("AddFive", TaskBody.of(args -> Map.of("plus_five", args.getInt("value") + 5), "value")))
                .addNode(new TaskNode("Merge", TaskBody.of(args -> {
                    mergeRuns.incrementAndGet();
                    return Map.of("result", args.getInt("doubled") + args.getInt("plus_five"));
                }, "doubled", "plus_five")))
                .connect("Start", "Double")
                .connect("Start", "AddFive")
                .connect("Double", "Merge")
                .connect("AddFive", "Merge");

        RunReport report = graph.execute(Map.of(), QUIET_CONTINUE);

        assertEquals(List.of("Start", "Double", "Merge", "AddFive"), report.getExecutionOrder());
        assertEquals(0, mergeRuns.get());
        assertEquals(NodeStatus.FAILED, report.getNode("Merge").status());
        assertEquals(NodeErrorKind.MISSING_INPUT, report.getNode("Merge").errorKind());
        assertEquals("plus_five", ((MissingInputException) graph.getNode("Merge").getError()).getParameterName());
        assertEquals(NodeStatus.SUCCEEDED, report.getNode("AddFive").status());
        assertEquals(15, report.getFinalContext().get("plus_five"));
        assertFalse(report.getFinalContext().containsKey("result"));
    }

    @Test
    void join_mergedInsideOneBody() {
        TaskGraph graph = new TaskGraph("Manual merge")
                .addNode(new TaskNode("Start", emit("value", 10)), true)
                .addNode(new TaskNode("Merge", TaskBody.of(args -> {
                    int value = args.getInt("value");
                    return Map.of("doubled", value * 2, "plus_five", value + 5, "result", value * 2 + value + 5);
                }, "value")))
                .connect("Start", "Merge");

        RunReport report = graph.execute(Map.of(), QUIET);

        assertEquals(RunStatus.SUCCEEDED, report.getStatus());
        assertEquals(35, report.getFinalContext().get("result"));
    }

    @Test
    void bodyThrowingError_recordedOnNode() {
        AtomicInteger afterRuns = new AtomicInteger();
        TaskGraph graph = new TaskGraph("Errors")
                .addNode(new TaskNode("A", TaskBody.of(args -> {
                    throw new AssertionError("boom");
                })), true)
                .addNode(new TaskNode("B", TaskBody.of(args -> {
                    afterRuns.incrementAndGet();
                    return Map.of();
                })))
                .connect("A", "B");

        RunReport report = graph.execute(Map.of(), QUIET);

        assertEquals(RunStatus.FAILED, report.getStatus());
        assertEquals(NodeStatus.FAILED, graph.getNode("A").getStatus());
        assertEquals(NodeErrorKind.BODY_ERROR, report.getNode("A").errorKind());
        assertTrue(graph.getNode("A").getError().getCause() instanceof AssertionError);
        assertEquals(NodeStatus.SKIPPED, report.getNode("B").status());
        assertEquals(0, afterRuns.get());
    }

    @Test
    void missingInput_stopOnErrorSkipsRest() {
        AtomicInteger bodyCalls = new AtomicInteger();
        TaskGraph graph = new TaskGraph("Missing")
                .addNode(new TaskNode("A", noop()), true)
                .addNode(new TaskNode("B", TaskBody.of(args -> {
                    bodyCalls.incrementAndGet();
                    return Map.of();
                }, "y")))
                .addNode(new TaskNode("C", noop()))
                .addNode(new TaskNode("D", noop()))
                .connect("A", "B")
                .connect("B", "C")
                .connect("A", "D");

        RunReport report = graph.execute(Map.of(), QUIET);

        assertEquals(0, bodyCalls.get());
        assertEquals(RunStatus.FAILED, report.getStatus());
        assertEquals(NodeStatus.FAILED, report.getNode("B").status());
        assertEquals(NodeErrorKind.MISSING_INPUT, report.getNode("B").errorKind());
        assertTrue(report.getNode("B").error().contains("'y'"));
        assertEquals(NodeStatus.SKIPPED, report.getNode("C").status());
        assertEquals(NodeStatus.SKIPPED, report.getNode("D").status());
        assertNull(report.getNode("C").error());
        MissingInputException error = (MissingInputException) graph.getNode("B").getError();
        assertEquals("y", error.getParameterName());
    }

    @Test
    void missingInput_continueRunsUnrelatedBranches() {
        TaskGraph graph = new TaskGraph("Missing")
                .addNode(new TaskNode("A", noop()), true)
                .addNode(new TaskNode("B", TaskBody.of(args -> Map.of(), "y")))
                .addNode(new TaskNode("C", noop()))
                .addNode(new TaskNode("D", emit("d", true)))
                .addNode(new TaskNode("E", TaskBody.of(args -> {
                    throw new IllegalStateException("boom");
                })))
                .connect("A", "B")
                .connect("B", "C")
                .connect("A", "D")
                .connect("A", "E");

        RunReport report = graph.execute(Map.of(), QUIET_CONTINUE);

        assertEquals(RunStatus.FAILED, report.getStatus());
        assertEquals(NodeStatus.FAILED, report.getNode("B").status());
        assertEquals(NodeStatus.SUCCEEDED, report.getNode("D").status());
        assertEquals(NodeStatus.FAILED, report.getNode("E").status());
        assertEquals(NodeErrorKind.BODY_ERROR, report.getNode("E").errorKind());
        // successors of a failed node are still visited
        assertEquals(NodeStatus.SUCCEEDED, report.getNode("C").status());
        assertEquals(List.of("A", "B", "C", "D", "E"), report.getExecutionOrder());
    }

    @Test
    void bindingPrecedence_fixedThenContextThenDefault() {
        AtomicReference<Map<String, Object>> bound = new AtomicReference<>();
        TaskBody body = TaskBody.of(List.of(
                TaskParameter.required("a"),
                TaskParameter.required("b"),
                TaskParameter.optional("c", "fallback")), args -> {
            bound.set(args.asMap());
            return Map.of();
        });
        TaskGraph graph = new TaskGraph("Binding")
                .addNode(new TaskNode("N", body, Map.of("a", "fixed")), true);

        graph.execute(Map.of("a", "context", "b", "context", "unrelated", 1), QUIET);

        assertEquals(Map.of("a", "fixed", "b", "context", "c", "fallback"), bound.get());
    }

    @Test
    void nullContextValueCountsAsPresent() {
        AtomicReference<Boolean> present = new AtomicReference<>();
        Map<String, Object> initial = new HashMap<>();
        initial.put("maybe", null);
        TaskGraph graph = new TaskGraph("Nulls")
                .addNode(new TaskNode("N", TaskBody.of(args -> {
                    present.set(args.contains("maybe"));
                    return Map.of();
                }, "maybe")), true);

        RunReport report = graph.execute(initial, QUIET);

        assertTrue(present.get());
        assertTrue(report.isSucceeded());
    }

    @Test
    void invalidOutput_failsNodeWithoutMerging() {
        TaskGraph graph = new TaskGraph("Invalid")
                .addNode(new TaskNode("Text", TaskBody.of(args -> "not a map")), true)
                .addNode(new TaskNode("Null", TaskBody.of(args -> null)), true)
                .addNode(new TaskNode("IntKeys", TaskBody.of(args -> Map.of(1, "one"))), true);

        RunReport report = graph.execute(Map.of("seed", 1), QUIET_CONTINUE);

        for (String name : List.of("Text", "Null", "IntKeys")) {
            assertEquals(NodeStatus.FAILED, report.getNode(name).status(), name);
            assertEquals(NodeErrorKind.INVALID_OUTPUT, report.getNode(name).errorKind(), name);
        }
        assertEquals(Map.of("seed", 1), report.getFinalContext());
    }

    @Test
    void bodyError_keepsCause() {
        IllegalStateException cause = new IllegalStateException("sensor offline");
        TaskGraph graph = new TaskGraph("Body")
                .addNode(new TaskNode("Load", TaskBody.of(args -> {
                    throw cause;
                })), true);

        RunReport report = graph.execute(Map.of(), QUIET);

        TaskExecutionException error = graph.getNode("Load").getError();
        assertTrue(error instanceof TaskBodyException);
        assertEquals(cause, error.getCause());
        assertTrue(report.getNode("Load").error().contains("sensor offline"));
    }

    @Test
    void laterOutputOverwritesEarlierKey() {
        TaskGraph graph = TaskGraphs.linear("Overwrite", List.of(
                TaskSpec.of("First", emit("x", 1)),
                TaskSpec.of("Second", emit("x", 2))));

        RunReport report = graph.execute(Map.of("x", 0), QUIET);

        assertEquals(2, report.getFinalContext().get("x"));
    }

    @Test
    void unreachableNodeSkipped_andZeroStartsSucceed() {
        TaskGraph graph = new TaskGraph("Unreachable")
                .addNode(new TaskNode("A", noop()), true)
                .addNode(new TaskNode("Orphan", noop()));

        RunReport report = graph.execute(Map.of(), QUIET);

        assertEquals(RunStatus.SUCCEEDED, report.getStatus());
        assertEquals(NodeStatus.SKIPPED, report.getNode("Orphan").status());

        TaskGraph noStarts = new TaskGraph("NoStarts").addNode(new TaskNode("A", noop()));
        RunReport empty = noStarts.execute(Map.of(), QUIET);
        assertEquals(RunStatus.SUCCEEDED, empty.getStatus());
        assertTrue(empty.getExecutionLog().isEmpty());
        assertEquals(NodeStatus.SKIPPED, empty.getNode("A").status());
    }

    @Test
    void rerun_resetsStateAndLog() {
        AtomicInteger attempt = new AtomicInteger();
        TaskGraph graph = new TaskGraph("Rerun")
                .addNode(new TaskNode("Flaky", TaskBody.of(args -> {
                    if (attempt.incrementAndGet() == 1) throw new IllegalStateException("first try");
                    return Map.of("ok", true);
                })), true)
                .addNode(new TaskNode("After", noop()))
                .connect("Flaky", "After");

        RunReport first = graph.execute(Map.of(), QUIET);
        RunReport second = graph.execute(Map.of(), QUIET);

        assertEquals(RunStatus.FAILED, first.getStatus());
        assertEquals(NodeStatus.SKIPPED, first.getNode("After").status());
        assertEquals(RunStatus.SUCCEEDED, second.getStatus());
        assertEquals(List.of("Flaky", "After"), second.getExecutionOrder());
        assertNull(second.getNode("Flaky").error());
        assertNull(graph.getNode("Flaky").getError());
        // earlier report is unaffected by the later run
        assertEquals(NodeStatus.FAILED, first.getNode("Flaky").status());
    }

    @Test
    void initialContextNotMutated() {
        Map<String, Object> initial = new HashMap<>();
        initial.put("subject", "S01");
        TaskGraph graph = new TaskGraph("Seed").addNode(new TaskNode("A", emit("x", 1)), true);

        graph.execute(initial, QUIET);

        assertEquals(Map.of("subject", "S01"), initial);
    }

    @Test
    void executionLog_hasTimestampsPerAttempt() {
        TaskGraph graph = new TaskGraph("Log")
                .addNode(new TaskNode("A", noop()), true)
                .addNode(new TaskNode("B", TaskBody.of(args -> Map.of(), "missing")))
                .connect("A", "B");

        RunReport report = graph.execute(Map.of(), QUIET);

        assertEquals(2, report.getExecutionLog().size());
        ExecutionLogEntry b = report.getExecutionLog().get(1);
        assertEquals("B", b.nodeName());
        assertEquals(NodeStatus.FAILED, b.status());
        assertNotNull(b.startedAt());
        assertFalse(b.finishedAt().isBefore(b.startedAt()));
        assertNotNull(report.getNode("A").executionTime());
    }

    @Test
    void features_observeEveryAttemptAndFailuresAreIgnored() {
        List<String> calls = new ArrayList<>();
        FeatureRegistry registry = new FeatureRegistry();
        registry.register("trace", FeaturePhase.PRE, (PreNodeCall) ctx -> calls.add("pre:" + ctx.getNodeName()));
        registry.register("outcome", FeaturePhase.POST,
                (PostNodeCall) ctx -> calls.add("post:" + ctx.getNodeName() + ":" + ctx.getStatus()));
        registry.register("broken", FeaturePhase.PRE, (PreNodeCall) ctx -> {
            throw new IllegalStateException("observer bug");
        });
        TaskGraph graph = new TaskGraph("Features")
                .addNode(new TaskNode("A", noop()), true)
                .addNode(new TaskNode("B", TaskBody.of(args -> Map.of(), "missing")))
                .connect("A", "B");
        ExecutionOptions options = ExecutionOptions.builder()
                .logSummary(false)
                .featureRegistry(registry)
                .features("broken", "trace", "outcome", "not-registered")
                .build();

        RunReport report = graph.execute(Map.of(), options);

        assertEquals(List.of("pre:A", "post:A:succeeded", "pre:B", "post:B:failed"), calls);
        assertEquals(NodeStatus.SUCCEEDED, report.getNode("A").status());
    }

    @Test
    void concurrentRunOfSameGraphRejected() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        TaskGraph graph = new TaskGraph("Blocking")
                .addNode(new TaskNode("Wait", TaskBody.of(args -> {
                    entered.countDown();
                    release.await(5, TimeUnit.SECONDS);
                    return Map.of();
                })), true);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<RunReport> first = pool.submit(() -> graph.execute(Map.of(), QUIET));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            assertThrows(IllegalStateException.class, () -> graph.execute(Map.of(), QUIET));

            release.countDown();
            assertTrue(first.get(5, TimeUnit.SECONDS).isSucceeded());
            assertTrue(graph.execute(Map.of(), QUIET).isSucceeded());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void fromConfig_readsPolicy() {
        ExecutionOptions options = ExecutionOptions.fromConfig(
                com.flowgraph.config.FlowGraphConfig.builder().stopOnError(false).logSummary(false)
                        .features(List.of("debug")).build(),
                new FeatureRegistry());

        assertFalse(options.isStopOnError());
        assertFalse(options.isLogSummary());
        assertEquals(List.of("debug"), options.getFeatureNames());
    }
}
