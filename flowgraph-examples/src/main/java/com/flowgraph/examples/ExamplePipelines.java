package com.flowgraph.examples;

import com.flowgraph.engine.graph.TaskGraph;
import com.flowgraph.engine.graph.TaskGraphs;
import com.flowgraph.engine.graph.TaskSpec;
import com.flowgraph.engine.task.MethodTaskBody;
import com.flowgraph.engine.task.TaskBody;
import com.flowgraph.engine.task.TaskNode;
import com.flowgraph.engine.task.TaskParameter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Example pipelines: a linear data pipeline, a branching pipeline whose merge step reads both
 * branches, and a gait analysis pipeline built from {@link GaitAnalysisTasks} methods.
 */
public final class ExamplePipelines {

    private ExamplePipelines() {
    }

    /** Load, then process (scale), then analyze (mean). */
    public static TaskGraph dataPipeline() {
        TaskBody load = TaskBody.of(args -> Map.of("data", List.of(1, 2, 3, 4, 5)));
        TaskBody process = TaskBody.of(List.of(TaskParameter.required("data"), TaskParameter.optional("factor", 2)),
                args -> {
                    int factor = args.getInt("factor");
                    List<Integer> processed = new ArrayList<>();
                    for (Number n : args.<Number>getList("data")) {
                        processed.add(n.intValue() * factor);
                    }
                    return Map.of("processed", processed);
                });
        TaskBody analyze = TaskBody.of(args -> {
            List<Number> values = args.getList("processed");
            double sum = 0;
            for (Number n : values) sum += n.doubleValue();
            return Map.of("mean", sum / values.size(), "count", values.size());
        }, "processed");
        return TaskGraphs.linear("Example Data Pipeline", "Load, process and analyze a small data set", List.of(
                TaskSpec.of("Load Data", load, "Load example data"),
                new TaskSpec("Process Data", process, Map.of("factor", 2), "Multiply each value"),
                TaskSpec.of("Analyze", analyze, "Compute the mean")));
    }

    /**
     * Start emits a value and fans out to Double, Add Five and Merge. A node runs on its first
     * arrival without waiting for other predecessors, so Merge combines both branches inside its own
     * body from the shared input instead of joining the Double and Add Five nodes.
     */
    public static TaskGraph branchingPipeline() {
        return new TaskGraph("Branching Pipeline", "Two branches merged into one result")
                .addNode(new TaskNode("Start", TaskBody.of(args -> Map.of("value", args.getInt("initial")), "initial"),
                        Map.of("initial", 10), "Emit the starting value"), true)
                .addNode(new TaskNode("Double", TaskBody.of(args -> Map.of("doubled", doubled(args.getInt("value"))), "value"),
                        null, "Multiply by two"))
                .addNode(new TaskNode("Add Five", TaskBody.of(args -> Map.of("plusFive", plusFive(args.getInt("value"))), "value"),
                        null, "Add five"))
                .addNode(new TaskNode("Merge", TaskBody.of(args -> {
                    int value = args.getInt("value");
                    return Map.of("result", doubled(value) + plusFive(value));
                }, "value"), null, "Sum both branches"))
                .connect("Start", "Double")
                .connect("Start", "Add Five")
                .connect("Start", "Merge");
    }

    private static int doubled(int value) {
        return value * 2;
    }

    private static int plusFive(int value) {
        return value + 5;
    }

    /** Setup, IK, then ID and SO side by side; JRA and the report follow SO. */
    public static TaskGraph gaitAnalysisPipeline(String projectFolder, String subjectName, String trialName) {
        GaitAnalysisTasks tasks = new GaitAnalysisTasks();
        Map<String, Object> subject = Map.of(
                "projectFolder", projectFolder,
                "subjectName", subjectName,
                "trialName", trialName);
        return new TaskGraph("Gait Analysis Pipeline", "IK -> ID and SO -> JRA -> report")
                .addNode(new TaskNode("Setup Paths", MethodTaskBody.annotated(tasks, "setup"), subject, null), true)
                .addNode(new TaskNode("Inverse Kinematics", MethodTaskBody.annotated(tasks, "ik")))
                .addNode(new TaskNode("Inverse Dynamics", MethodTaskBody.annotated(tasks, "id")))
                .addNode(new TaskNode("Static Optimization", MethodTaskBody.annotated(tasks, "so")))
                .addNode(new TaskNode("Joint Reaction Analysis", MethodTaskBody.annotated(tasks, "jra")))
                .addNode(new TaskNode("Generate Report", MethodTaskBody.annotated(tasks, "report"), subject, null))
                .connect("Setup Paths", "Inverse Kinematics")
                .connect("Inverse Kinematics", "Inverse Dynamics")
                .connect("Inverse Kinematics", "Static Optimization")
                .connect("Static Optimization", "Joint Reaction Analysis")
                .connect("Joint Reaction Analysis", "Generate Report");
    }

    public static List<TaskGraph> all() {
        return List.of(dataPipeline(), branchingPipeline(),
                gaitAnalysisPipeline("/data/project", "Subject01", "walking_01"));
    }
}
