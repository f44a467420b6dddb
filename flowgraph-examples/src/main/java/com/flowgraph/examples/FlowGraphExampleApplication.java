package com.flowgraph.examples;

import com.flowgraph.config.FlowGraphConfig;
import com.flowgraph.engine.execution.ExecutionOptions;
import com.flowgraph.engine.graph.TaskGraph;
import com.flowgraph.engine.report.RunReport;
import com.flowgraph.engine.report.RunReportJson;
import com.flowgraph.features.FeatureRegistry;
import com.flowgraph.features.debug.DebuggerFeature;
import com.flowgraph.features.metrics.MetricsFeature;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs the example pipelines. Configuration comes from the environment
 * ({@link FlowGraphConfig#fromEnvironment()}): error policy, summary logging, features
 * (e.g. FLOWGRAPH_FEATURES=debug,metrics) and the directory the pipeline structures are exported to.
 * Exit code 1 when any pipeline failed.
 */
public final class FlowGraphExampleApplication {

    private static final Logger log = LoggerFactory.getLogger(FlowGraphExampleApplication.class);

    private FlowGraphExampleApplication() {
    }

    public static void main(String[] args) {
        FlowGraphConfig config = FlowGraphConfig.fromEnvironment();
        log.info("Starting FlowGraph examples | config={}", config);
        List<RunReport> reports = run(config, FeatureRegistry.getInstance(), ExamplePipelines.all());
        boolean failed = reports.stream().anyMatch(r -> !r.isSucceeded());
        if (failed) {
            System.exit(1);
        }
    }

    /**
     * Registers the bundled features (if not yet registered), then for each graph: logs its
     * visualization, runs it, exports its structure to {@code exportDir/<slug>.json}.
     */
    public static List<RunReport> run(FlowGraphConfig config, FeatureRegistry registry, List<TaskGraph> graphs) {
        MetricsFeature metrics = registerFeatures(registry);
        ExecutionOptions options = ExecutionOptions.fromConfig(config, registry);
        Path exportDir = Path.of(config.getExportDir());
        List<RunReport> reports = new ArrayList<>();
        for (TaskGraph graph : graphs) {
            log.info("Pipeline structure\n{}", graph.visualize());
            RunReport report = graph.execute(Map.of(), options);
            reports.add(report);
            Path file = exportDir.resolve(slug(graph.getName()) + ".json");
            graph.saveStructure(file);
            if (log.isDebugEnabled()) {
                log.debug("Run report | pipeline={} | json={}", graph.getName(), RunReportJson.toJson(report));
            }
            log.info("Pipeline done | pipeline={} | status={} | export={}", graph.getName(), report.getStatus(), file);
        }
        if (metrics != null && options.getFeatureNames().contains(MetricsFeature.NAME)) {
            for (Counter c : metrics.getRegistry().find(MetricsFeature.EXECUTIONS).counters()) {
                log.info("Metric {} | pipeline={} | status={} | count={}", MetricsFeature.EXECUTIONS,
                        c.getId().getTag("pipeline"), c.getId().getTag("status"), (long) c.count());
            }
        }
        return reports;
    }

    private static MetricsFeature registerFeatures(FeatureRegistry registry) {
        if (registry.get(DebuggerFeature.NAME) == null) {
            registry.register(new DebuggerFeature());
        }
        FeatureRegistry.FeatureEntry entry = registry.get(MetricsFeature.NAME);
        if (entry == null) {
            MetricsFeature metrics = new MetricsFeature();
            registry.register(metrics);
            return metrics;
        }
        return entry.getInstance() instanceof MetricsFeature m ? m : null;
    }

    /** File-name form of a pipeline name: lower case, non-alphanumerics collapsed to '-'. */
    static String slug(String name) {
        String s = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        s = s.replaceAll("^-+|-+$", "");
        return s.isEmpty() ? "pipeline" : s;
    }
}
