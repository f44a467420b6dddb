package com.flowgraph.engine.execution;

import com.flowgraph.config.FlowGraphConfig;
import com.flowgraph.features.FeatureRegistry;

import java.util.List;
import java.util.Objects;

/**
 * Per-run options: error policy, end-of-run summary logging and the features attached to the run.
 * Build with {@link #builder()} or derive from {@link FlowGraphConfig} via {@link #fromConfig}.
 */
public final class ExecutionOptions {

    private static final ExecutionOptions DEFAULTS = builder().build();

    private final boolean stopOnError;
    private final boolean logSummary;
    private final List<String> featureNames;
    private final FeatureRegistry featureRegistry;

    private ExecutionOptions(Builder b) {
        this.stopOnError = b.stopOnError;
        this.logSummary = b.logSummary;
        this.featureNames = b.featureNames != null ? List.copyOf(b.featureNames) : List.of();
        this.featureRegistry = b.featureRegistry != null ? b.featureRegistry : FeatureRegistry.getInstance();
    }

    /** stopOnError=true, logSummary=true, no features. */
    public static ExecutionOptions defaults() {
        return DEFAULTS;
    }

    /** Options from configuration; features resolve against the global registry. */
    public static ExecutionOptions fromConfig(FlowGraphConfig config) {
        return fromConfig(config, FeatureRegistry.getInstance());
    }

    public static ExecutionOptions fromConfig(FlowGraphConfig config, FeatureRegistry registry) {
        Objects.requireNonNull(config, "config");
        return builder()
                .stopOnError(config.isStopOnError())
                .logSummary(config.isLogSummary())
                .features(config.getFeatures())
                .featureRegistry(registry)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** When true, the first failed node halts the run and every still-pending node is skipped. */
    public boolean isStopOnError() {
        return stopOnError;
    }

    public boolean isLogSummary() {
        return logSummary;
    }

    /** Feature names to attach, in invocation order. Unregistered names are ignored. */
    public List<String> getFeatureNames() {
        return featureNames;
    }

    public FeatureRegistry getFeatureRegistry() {
        return featureRegistry;
    }

    @Override
    public String toString() {
        return "ExecutionOptions{stopOnError=" + stopOnError + ", logSummary=" + logSummary
                + ", features=" + featureNames + "}";
    }

    public static final class Builder {
        private boolean stopOnError = true;
        private boolean logSummary = true;
        private List<String> featureNames = List.of();
        private FeatureRegistry featureRegistry;

        private Builder() {
        }

        public Builder stopOnError(boolean stopOnError) {
            this.stopOnError = stopOnError;
            return this;
        }

        public Builder logSummary(boolean logSummary) {
            this.logSummary = logSummary;
            return this;
        }

        public Builder features(List<String> featureNames) {
            this.featureNames = featureNames;
            return this;
        }

        public Builder features(String... featureNames) {
            this.featureNames = List.of(featureNames);
            return this;
        }

        public Builder featureRegistry(FeatureRegistry featureRegistry) {
            this.featureRegistry = featureRegistry;
            return this;
        }

        public ExecutionOptions build() {
            return new ExecutionOptions(this);
        }
    }
}
