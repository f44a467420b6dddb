package com.flowgraph.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Engine configuration loaded from environment variables.
 * <p>
 * FLOWGRAPH_STOP_ON_ERROR (default true) halts a run at the first failed node.
 * FLOWGRAPH_LOG_SUMMARY (default true) logs the per-node summary when a run ends.
 * FLOWGRAPH_FEATURES is a comma-separated list of feature names attached to every run (e.g. debug,metrics).
 * FLOWGRAPH_EXPORT_DIR is where pipeline structure documents are written (default build/pipelines).
 */
public final class FlowGraphConfig {

    private static final Logger log = LoggerFactory.getLogger(FlowGraphConfig.class);

    public static final String ENV_STOP_ON_ERROR = "FLOWGRAPH_STOP_ON_ERROR";
    public static final String ENV_LOG_SUMMARY = "FLOWGRAPH_LOG_SUMMARY";
    public static final String ENV_FEATURES = "FLOWGRAPH_FEATURES";
    public static final String ENV_EXPORT_DIR = "FLOWGRAPH_EXPORT_DIR";

    private static final boolean DEFAULT_STOP_ON_ERROR = true;
    private static final boolean DEFAULT_LOG_SUMMARY = true;
    private static final String DEFAULT_EXPORT_DIR = "build/pipelines";

    private final boolean stopOnError;
    private final boolean logSummary;
    private final List<String> features;
    private final String exportDir;

    private FlowGraphConfig(Builder b) {
        this.stopOnError = b.stopOnError;
        this.logSummary = b.logSummary;
        this.features = Collections.unmodifiableList(new ArrayList<>(b.features));
        this.exportDir = b.exportDir;
    }

    /** Whether traversal halts at the first failed node. Default true. */
    public boolean isStopOnError() {
        return stopOnError;
    }

    /** Whether the run summary is logged when a run ends. Default true. */
    public boolean isLogSummary() {
        return logSummary;
    }

    /** Feature names attached to every run, in order. Default empty. */
    public List<String> getFeatures() {
        return features;
    }

    /** Directory for exported pipeline structure documents. Default {@code build/pipelines}. */
    public String getExportDir() {
        return exportDir;
    }

    public static FlowGraphConfig defaults() {
        return builder().build();
    }

    public static FlowGraphConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /**
     * Builds the configuration from a variable map (same keys as the environment).
     * Unparseable values fall back to the default with a warning.
     */
    public static FlowGraphConfig fromMap(Map<String, String> env) {
        Map<String, String> source = env != null ? env : Map.of();
        return builder()
                .stopOnError(parseBoolean(ENV_STOP_ON_ERROR, source.get(ENV_STOP_ON_ERROR), DEFAULT_STOP_ON_ERROR))
                .logSummary(parseBoolean(ENV_LOG_SUMMARY, source.get(ENV_LOG_SUMMARY), DEFAULT_LOG_SUMMARY))
                .features(parseCommaSeparated(source.get(ENV_FEATURES)))
                .exportDir(getOrDefault(source, ENV_EXPORT_DIR, DEFAULT_EXPORT_DIR))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static boolean parseBoolean(String key, String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String v = value.trim();
        if ("true".equalsIgnoreCase(v) || "1".equals(v)) return true;
        if ("false".equalsIgnoreCase(v) || "0".equals(v)) return false;
        log.warn("Invalid boolean for {}={}; using default {}", key, value, defaultValue);
        return defaultValue;
    }

    private static String getOrDefault(Map<String, String> source, String key, String defaultValue) {
        String v = source.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "FlowGraphConfig{stopOnError=" + stopOnError
                + ", logSummary=" + logSummary
                + ", features=" + features
                + ", exportDir=" + exportDir + "}";
    }

    public static final class Builder {
        private boolean stopOnError = DEFAULT_STOP_ON_ERROR;
        private boolean logSummary = DEFAULT_LOG_SUMMARY;
        private List<String> features = List.of();
        private String exportDir = DEFAULT_EXPORT_DIR;

        public Builder stopOnError(boolean stopOnError) {
            this.stopOnError = stopOnError;
            return this;
        }

        public Builder logSummary(boolean logSummary) {
            this.logSummary = logSummary;
            return this;
        }

        public Builder features(List<String> features) {
            this.features = Objects.requireNonNull(features, "features");
            return this;
        }

        public Builder exportDir(String exportDir) {
            this.exportDir = exportDir != null ? exportDir : DEFAULT_EXPORT_DIR;
            return this;
        }

        public FlowGraphConfig build() {
            return new FlowGraphConfig(this);
        }
    }
}
