/**
 * Per-run execution context: the shared, mutating key/value accumulator through which task
 * outputs reach downstream task parameters. Created fresh for every run and passed explicitly
 * into each scheduler step.
 */
package com.flowgraph.executioncontext;
