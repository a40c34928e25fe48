package works.scenegen.scene;

import org.jetbrains.annotations.Nullable;

/**
 * A pre-built part of a scene whose nodes are looked up by path
 * rather than constructed again.
 */
public interface AnchorContainer {
	/**
	 * @param path names of the nodes from just below the container down to the target,
	 *             separated by {@code /}
	 * @return the node, or null if there's no such node
	 */
	@Nullable SceneNode find(String path);
}
