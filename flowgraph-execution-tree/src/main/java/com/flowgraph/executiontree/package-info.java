/**
 * Pipeline structure: export-only description of a task graph and its JSON serialization.
 *
 * <ul>
 *   <li>{@link com.flowgraph.executiontree.structure} – {@link com.flowgraph.executiontree.structure.PipelineStructure},
 *       its nodes and edges</li>
 *   <li>{@link com.flowgraph.executiontree.PipelineStructureJson} – {@code fromJson}/{@code toJson}, file read/write</li>
 * </ul>
 */
package com.flowgraph.executiontree;
