package com.flowgraph.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as a task body. The method's parameters are bound by name against the node's
 * fixed inputs and the execution context; it must return a {@code Map<String, ?>} of named outputs.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface TaskFunction {

    /** Lookup key when a class carries several task functions. Empty = the method name. */
    String value() default "";

    /** Optional description, used when the task node is built without one. */
    String description() default "";
}
