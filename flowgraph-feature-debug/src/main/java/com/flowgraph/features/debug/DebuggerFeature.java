package com.flowgraph.features.debug;

import com.flowgraph.annotations.FeaturePhase;
import com.flowgraph.annotations.FlowFeature;
import com.flowgraph.features.FeatureRegistry;
import com.flowgraph.features.NodeCallContext;
import com.flowgraph.features.PostNodeCall;
import com.flowgraph.features.PreNodeCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Debugger feature: pre and post hooks for every node when "debug" is in the run's feature list.
 * Register with {@link FeatureRegistry#getInstance()}.register(new DebuggerFeature()).
 */
@FlowFeature(name = DebuggerFeature.NAME, phase = FeaturePhase.PRE_POST)
public final class DebuggerFeature implements PreNodeCall, PostNodeCall {

    public static final String NAME = "debug";

    private static final Logger log = LoggerFactory.getLogger(DebuggerFeature.class);

    @Override
    public void before(NodeCallContext context) {
        log.info("[DEBUG] pre  pipeline={} node={} description={}",
                context.getPipelineName(), context.getNodeName(), context.getDescription());
    }

    @Override
    public void after(NodeCallContext context) {
        long millis = context.getExecutionTime() != null ? context.getExecutionTime().toMillis() : 0L;
        if (context.isExecutionSucceeded()) {
            log.info("[DEBUG] post pipeline={} node={} status={} timeMs={} outputKeys={}",
                    context.getPipelineName(), context.getNodeName(), context.getStatus(), millis,
                    context.getOutput().keySet());
        } else {
            log.info("[DEBUG] post pipeline={} node={} status={} timeMs={} error={}",
                    context.getPipelineName(), context.getNodeName(), context.getStatus(), millis,
                    context.getErrorMessage());
        }
    }
}
