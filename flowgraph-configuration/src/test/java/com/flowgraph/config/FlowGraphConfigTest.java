package com.flowgraph.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlowGraphConfigTest {

    @Test
    void defaults_stopOnErrorAndLogSummary() {
        FlowGraphConfig config = FlowGraphConfig.defaults();

        assertTrue(config.isStopOnError());
        assertTrue(config.isLogSummary());
        assertTrue(config.getFeatures().isEmpty());
        assertEquals("build/pipelines", config.getExportDir());
    }

    @Test
    void fromMap_readsEveryKey() {
        FlowGraphConfig config = FlowGraphConfig.fromMap(Map.of(
                FlowGraphConfig.ENV_STOP_ON_ERROR, "false",
                FlowGraphConfig.ENV_LOG_SUMMARY, "0",
                FlowGraphConfig.ENV_FEATURES, " debug , metrics,, ",
                FlowGraphConfig.ENV_EXPORT_DIR, " out/structures "));

        assertFalse(config.isStopOnError());
        assertFalse(config.isLogSummary());
        assertEquals(List.of("debug", "metrics"), config.getFeatures());
        assertEquals("out/structures", config.getExportDir());
    }

    @Test
    void fromMap_invalidBooleanFallsBackToDefault() {
        FlowGraphConfig config = FlowGraphConfig.fromMap(Map.of(FlowGraphConfig.ENV_STOP_ON_ERROR, "maybe"));

        assertTrue(config.isStopOnError());
    }

    @Test
    void fromMap_nullMapUsesDefaults() {
        FlowGraphConfig config = FlowGraphConfig.fromMap(null);

        assertTrue(config.isStopOnError());
        assertEquals("build/pipelines", config.getExportDir());
    }
}
