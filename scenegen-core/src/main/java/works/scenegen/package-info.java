/**
 * Generates Java factory classes that rebuild a scene graph.
 * Start with {@link works.scenegen.SceneCodeGenerator}.
 */
package works.scenegen;
