package com.flowgraph.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a feature that observes node execution during graph traversal.
 * Register instances with a feature registry; implement the pre/post call contracts matching {@link #phase()}.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface FlowFeature {

    /** Unique feature identifier (used in execution options and in the registry). */
    String name();

    /** When to invoke: PRE, POST, or PRE_POST (before and after). */
    FeaturePhase phase() default FeaturePhase.PRE_POST;
}
