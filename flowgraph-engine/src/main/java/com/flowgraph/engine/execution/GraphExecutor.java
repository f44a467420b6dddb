package com.flowgraph.engine.execution;

import com.flowgraph.engine.graph.TaskGraph;
import com.flowgraph.engine.report.ExecutionLogEntry;
import com.flowgraph.engine.report.NodeReport;
import com.flowgraph.engine.report.RunReport;
import com.flowgraph.engine.report.RunStatus;
import com.flowgraph.engine.report.RunSummaryPrinter;
import com.flowgraph.engine.task.NodeStatus;
import com.flowgraph.engine.task.TaskNode;
import com.flowgraph.executioncontext.ExecutionContext;
import com.flowgraph.features.NodeCallContext;
import com.flowgraph.features.NodeFeatureRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs a {@link TaskGraph}: single-threaded depth-first (pre-order) traversal from the start nodes,
 * following edges in insertion order, with first-visit deduplication so every node runs at most once
 * per run even with diamonds or cycles. A node with several predecessors runs as soon as the first
 * of them reaches it, with the context populated up to that point; it does not wait for the others.
 * <p>
 * Per node: mark running, pre features, bind parameters, invoke, merge output into the context,
 * post features, then push successors. Node failures are recorded on the node and never thrown
 * from {@link #execute}; with stopOnError the first failure halts the run. Every node still
 * pending at the end is skipped.
 */
public final class GraphExecutor {

    private static final Logger log = LoggerFactory.getLogger(GraphExecutor.class);

    /** Graphs with a run in progress (identity; TaskGraph does not override equals). */
    private static final Set<TaskGraph> RUNNING = ConcurrentHashMap.newKeySet();

    private final ExecutionOptions options;
    private final ParameterBinder binder = new ParameterBinder();
    private final NodeInvoker invoker = new NodeInvoker();

    public GraphExecutor(ExecutionOptions options) {
        this.options = options != null ? options : ExecutionOptions.defaults();
    }

    /**
     * Runs the graph with a fresh context seeded from {@code initialContext} (copied; may be null).
     *
     * @throws IllegalStateException if the same graph is already running on another thread
     */
    public RunReport execute(TaskGraph graph, Map<String, ?> initialContext) {
        Objects.requireNonNull(graph, "graph");
        if (!RUNNING.add(graph)) {
            throw new IllegalStateException("Pipeline is already running: " + graph.getName());
        }
        try {
            return run(graph, initialContext);
        } finally {
            RUNNING.remove(graph);
        }
    }

    private RunReport run(TaskGraph graph, Map<String, ?> initialContext) {
        List<TaskNode> nodes = graph.getNodes();
        for (TaskNode node : nodes) {
            node.reset();
        }
        ExecutionContext context = ExecutionContext.seededWith(initialContext);
        NodeFeatureRunner features = new NodeFeatureRunner(
                options.getFeatureRegistry().resolve(options.getFeatureNames()));
        // head of the deque is the next node to visit
        Deque<String> pending = new ArrayDeque<>(graph.getStartNodes());
        Set<String> visited = new HashSet<>();
        List<ExecutionLogEntry> executionLog = new ArrayList<>();

        if (log.isInfoEnabled()) {
            log.info("Pipeline start | pipeline={} | nodes={} | startNodes={} | stopOnError={}",
                    graph.getName(), nodes.size(), graph.getStartNodes(), options.isStopOnError());
        }
        long startNanos = System.nanoTime();
        boolean halted = false;
        while (!pending.isEmpty() && !halted) {
            String name = pending.pollFirst();
            if (!visited.add(name)) {
                continue;
            }
            TaskNode node = graph.getNode(name);
            runNode(graph, node, context, features);
            executionLog.add(new ExecutionLogEntry(name, node.getStartedAt(), node.getFinishedAt(), node.getStatus()));

            List<String> successors = graph.successors(name);
            for (int i = successors.size() - 1; i >= 0; i--) {
                String next = successors.get(i);
                if (!visited.contains(next)) {
                    pending.addFirst(next);
                }
            }
            if (node.getStatus() == NodeStatus.FAILED && options.isStopOnError()) {
                halted = true;
                log.warn("Pipeline halted | pipeline={} | failedNode={} | stopOnError=true", graph.getName(), name);
            }
        }

        Map<String, NodeReport> nodeReports = new LinkedHashMap<>();
        boolean anyFailed = false;
        for (TaskNode node : nodes) {
            if (node.getStatus() == NodeStatus.PENDING) {
                node.markSkipped();
            }
            anyFailed |= node.getStatus() == NodeStatus.FAILED;
            nodeReports.put(node.getName(), NodeReport.of(node));
        }
        Duration totalTime = Duration.ofNanos(System.nanoTime() - startNanos);
        RunStatus status = anyFailed ? RunStatus.FAILED : RunStatus.SUCCEEDED;
        RunReport report = new RunReport(graph.getName(), status, totalTime, nodeReports,
                context.snapshot(), executionLog);

        if (log.isInfoEnabled()) {
            log.info("Pipeline end | pipeline={} | status={} | totalTimeMs={} | attempted={}",
                    graph.getName(), status.getValue(), totalTime.toMillis(), executionLog.size());
        }
        if (options.isLogSummary()) {
            RunSummaryPrinter.print(report);
        }
        return report;
    }

    private void runNode(TaskGraph graph, TaskNode node, ExecutionContext context, NodeFeatureRunner features) {
        if (log.isInfoEnabled()) {
            log.info("Executing: {} | pipeline={} | description={}", node.getName(), graph.getName(), node.getDescription());
        }
        long t0 = System.nanoTime();
        node.markRunning(Instant.now());
        NodeCallContext callContext = new NodeCallContext(graph.getName(), node.getName(), node.getDescription());
        features.runPre(callContext);
        try {
            Map<String, Object> arguments = binder.bind(node, context);
            Map<String, Object> output = invoker.invoke(node, arguments);
            context.merge(output);
            node.markSucceeded(output, Instant.now(), Duration.ofNanos(System.nanoTime() - t0));
            if (log.isInfoEnabled()) {
                log.info("Node completed | pipeline={} | node={} | timeMs={} | outputKeys={}",
                        graph.getName(), node.getName(), node.getExecutionTime().toMillis(), output.keySet());
            }
        } catch (TaskExecutionException e) {
            node.markFailed(e, Instant.now(), Duration.ofNanos(System.nanoTime() - t0));
            if (e.getKind() == NodeErrorKind.BODY_ERROR) {
                log.warn("Node failed | pipeline={} | node={} | kind={} | error={}",
                        graph.getName(), node.getName(), e.getKind().getLabel(), e.getMessage(), e.getCause());
            } else {
                log.warn("Node failed | pipeline={} | node={} | kind={} | error={}",
                        graph.getName(), node.getName(), e.getKind().getLabel(), e.getMessage());
            }
        }
        boolean succeeded = node.getStatus() == NodeStatus.SUCCEEDED;
        features.runPost(callContext.withOutcome(node.getStatus().getValue(), succeeded, node.getExecutionTime(),
                node.getError() != null ? node.getError().getMessage() : null, node.getOutput()));
    }
}
