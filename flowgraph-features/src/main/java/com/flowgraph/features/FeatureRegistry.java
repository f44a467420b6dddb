package com.flowgraph.features;

import com.flowgraph.annotations.FeaturePhase;
import com.flowgraph.annotations.FlowFeature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Registry of features. Register instances of classes annotated with {@link FlowFeature};
 * look up by name or resolve an ordered list of names for a run.
 * {@link #getInstance()} is the process-wide registry; tests and embedders can create their own.
 */
public final class FeatureRegistry {

    private static final FeatureRegistry INSTANCE = new FeatureRegistry();

    private final Map<String, FeatureEntry> byName = Collections.synchronizedMap(new LinkedHashMap<>());

    public static FeatureRegistry getInstance() {
        return INSTANCE;
    }

    public FeatureRegistry() {
    }

    /**
     * Registers a feature instance. Reads {@link FlowFeature} from the class and stores by {@link FlowFeature#name()}.
     * The instance must implement {@link PreNodeCall} and/or {@link PostNodeCall}.
     *
     * @throws IllegalArgumentException if the class is not annotated, implements no hook for its phase, or the name is taken
     */
    public void register(Object featureInstance) {
        Objects.requireNonNull(featureInstance, "featureInstance");
        Class<?> clazz = featureInstance.getClass();
        FlowFeature ann = clazz.getAnnotation(FlowFeature.class);
        if (ann == null) {
            throw new IllegalArgumentException("Feature implementation must be annotated with @FlowFeature: " + clazz.getName());
        }
        register(ann.name(), ann.phase(), featureInstance);
    }

    /** Registers a feature with explicit metadata (e.g. a lambda that cannot carry the annotation). */
    public void register(String name, FeaturePhase phase, Object featureInstance) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(featureInstance, "featureInstance");
        if (name.isBlank()) throw new IllegalArgumentException("feature name must be non-blank");
        if (!(featureInstance instanceof PreNodeCall) && !(featureInstance instanceof PostNodeCall)) {
            throw new IllegalArgumentException("Feature " + name + " implements neither PreNodeCall nor PostNodeCall");
        }
        FeatureEntry entry = new FeatureEntry(name, phase, featureInstance);
        if (!entry.isPre() && !entry.isPost()) {
            throw new IllegalArgumentException("Feature " + name + " has phase " + entry.getPhase()
                    + " but does not implement the matching hook");
        }
        if (byName.putIfAbsent(name, entry) != null) {
            throw new IllegalArgumentException("Feature already registered: " + name);
        }
    }

    /** Removes a feature; returns true if it was registered. */
    public boolean unregister(String name) {
        return name != null && byName.remove(name) != null;
    }

    public FeatureEntry get(String name) {
        return name != null ? byName.get(name) : null;
    }

    /**
     * Returns the entries for the given names, in the given order. Names that are not registered are skipped.
     */
    public List<FeatureEntry> resolve(List<String> featureNames) {
        if (featureNames == null || featureNames.isEmpty()) return List.of();
        List<FeatureEntry> out = new ArrayList<>();
        for (String name : featureNames) {
            FeatureEntry e = get(name);
            if (e != null) out.add(e);
        }
        return Collections.unmodifiableList(out);
    }

    public Map<String, FeatureEntry> getAll() {
        synchronized (byName) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(byName));
        }
    }

    /**
     * Registered feature: metadata plus the implementation instance.
     */
    public static final class FeatureEntry {
        private final String name;
        private final FeaturePhase phase;
        private final Object instance;

        FeatureEntry(String name, FeaturePhase phase, Object instance) {
            this.name = name;
            this.phase = phase != null ? phase : FeaturePhase.PRE_POST;
            this.instance = instance;
        }

        public String getName() { return name; }
        public FeaturePhase getPhase() { return phase; }
        public Object getInstance() { return instance; }

        public boolean isPre() { return phase.includesPre() && instance instanceof PreNodeCall; }
        public boolean isPost() { return phase.includesPost() && instance instanceof PostNodeCall; }
    }
}
