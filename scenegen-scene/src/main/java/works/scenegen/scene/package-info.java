/**
 * A small in-process scene model: a tree of {@link works.scenegen.scene.SceneNode}s,
 * each with a {@link works.scenegen.scene.Transform} and any number of attached
 * {@link works.scenegen.scene.Behavior}s whose public fields may refer to
 * other nodes, behaviors, or transforms anywhere in the scene.
 * <p>
 * Code generated by scenegen compiles against this package.
 */
package works.scenegen.scene;
