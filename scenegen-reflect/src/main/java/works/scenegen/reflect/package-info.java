/**
 * Connects the generator to the {@code works.scenegen.scene} model.
 * {@link works.scenegen.reflect.SceneGenerators} is the usual entry point.
 */
package works.scenegen.reflect;
