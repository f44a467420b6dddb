package com.flowgraph.features;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Single responsibility: run pre- and post-node feature hooks. Features are observers:
 * a hook that throws is logged and the run continues.
 */
public final class NodeFeatureRunner {

    private static final Logger log = LoggerFactory.getLogger(NodeFeatureRunner.class);

    private final List<FeatureRegistry.FeatureEntry> features;

    public NodeFeatureRunner(List<FeatureRegistry.FeatureEntry> features) {
        this.features = features != null ? List.copyOf(features) : List.of();
    }

    public boolean isEmpty() {
        return features.isEmpty();
    }

    public void runPre(NodeCallContext context) {
        for (FeatureRegistry.FeatureEntry e : features) {
            if (!e.isPre()) continue;
            try {
                ((PreNodeCall) e.getInstance()).before(context);
            } catch (RuntimeException ex) {
                log.warn("Pre feature {} failed for node={} (observer-only); continuing", e.getName(), context.getNodeName(), ex);
            }
        }
    }

    public void runPost(NodeCallContext context) {
        for (FeatureRegistry.FeatureEntry e : features) {
            if (!e.isPost()) continue;
            try {
                ((PostNodeCall) e.getInstance()).after(context);
            } catch (RuntimeException ex) {
                log.warn("Post feature {} failed for node={} (observer-only); continuing", e.getName(), context.getNodeName(), ex);
            }
        }
    }
}
