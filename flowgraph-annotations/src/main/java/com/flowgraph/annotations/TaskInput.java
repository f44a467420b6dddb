package com.flowgraph.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Names a task function parameter and optionally gives it a default.
 * Without this annotation the compiled parameter name is used (requires {@code -parameters}).
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
public @interface TaskInput {

    /** Marker for "no default declared"; annotation members cannot be null. */
    String NO_DEFAULT = "\u0000flowgraph:no-default";

    /** Parameter name looked up in fixed inputs and the execution context. Empty = compiled name. */
    String value() default "";

    /**
     * Default used when neither fixed inputs nor the context provide the parameter.
     * Converted to the parameter type (e.g. "6" for an int). {@link #NO_DEFAULT} = required.
     */
    String defaultValue() default NO_DEFAULT;
}
