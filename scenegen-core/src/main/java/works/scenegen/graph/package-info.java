/**
 * The view of a host scene graph that the generator works from.
 * <p>
 * A host supplies {@link works.scenegen.graph.GraphNode}s and
 * {@link works.scenegen.graph.GraphBehavior}s, and implements
 * {@link works.scenegen.graph.SceneReflector} to expose behavior fields
 * as {@link works.scenegen.graph.FieldValue}s. Nothing in the generator
 * names a concrete host type; the spelling of host operations in the output
 * comes from a {@link works.scenegen.emit.TargetDialect}.
 */
package works.scenegen.graph;
