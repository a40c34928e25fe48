/**
 * The graph walk. {@link works.scenegen.emit.GraphEmitter} decides what to construct
 * and in which order, and {@link works.scenegen.emit.TargetDialect} decides how it's spelled.
 */
package works.scenegen.emit;
