/**
 * FlowGraph features: annotation-based registration and pre/post node call contracts.
 * <ul>
 *   <li>{@link com.flowgraph.annotations.FlowFeature} – annotate a class to register it as a feature (name, phase)</li>
 *   <li>{@link com.flowgraph.features.PreNodeCall} / {@link com.flowgraph.features.PostNodeCall} – hook contracts</li>
 *   <li>{@link com.flowgraph.features.FeatureRegistry} – registry; resolve the features attached to a run by name</li>
 *   <li>{@link com.flowgraph.features.NodeFeatureRunner} – invokes resolved hooks; hook failures never fail a node</li>
 * </ul>
 */
package com.flowgraph.features;
