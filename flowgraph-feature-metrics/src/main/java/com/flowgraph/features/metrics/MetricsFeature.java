package com.flowgraph.features.metrics;

import com.flowgraph.annotations.FeaturePhase;
import com.flowgraph.annotations.FlowFeature;
import com.flowgraph.features.NodeCallContext;
import com.flowgraph.features.PostNodeCall;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.Objects;

/**
 * Feature that records node execution metrics: a counter per pipeline and status
 * ({@value #EXECUTIONS}) and a timer per pipeline, node and status ({@value #DURATION}).
 * Uses a {@link SimpleMeterRegistry} unless a registry is supplied.
 */
@FlowFeature(name = MetricsFeature.NAME, phase = FeaturePhase.POST)
public final class MetricsFeature implements PostNodeCall {

    public static final String NAME = "metrics";

    public static final String EXECUTIONS = "flowgraph.node.executions";
    public static final String DURATION = "flowgraph.node.duration";

    private final MeterRegistry registry;

    public MetricsFeature() {
        this(new SimpleMeterRegistry());
    }

    public MetricsFeature(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void after(NodeCallContext ctx) {
        String pipeline = nullToUnknown(ctx.getPipelineName());
        String status = nullToUnknown(ctx.getStatus());

        registry.counter(EXECUTIONS,
                "pipeline", pipeline,
                "status", status
        ).increment();

        Duration time = ctx.getExecutionTime() != null ? ctx.getExecutionTime() : Duration.ZERO;
        Timer.builder(DURATION)
                .tag("pipeline", pipeline)
                .tag("node", ctx.getNodeName())
                .tag("status", status)
                .register(registry)
                .record(time);
    }

    private static String nullToUnknown(String s) {
        return s != null && !s.isBlank() ? s : "unknown";
    }
}
