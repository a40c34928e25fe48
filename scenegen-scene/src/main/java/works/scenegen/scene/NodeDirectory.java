package works.scenegen.scene;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;

/**
 * An {@link AnchorContainer} backed by an explicit table of paths,
 * as filled in by generated factory code.
 */
public final class NodeDirectory implements AnchorContainer {
	private final SceneNode root;
	private final Map<String, SceneNode> nodesByPath = new LinkedHashMap<>();

	public NodeDirectory(SceneNode root) {
		this.root = requireNonNull(root);
	}

	public SceneNode root() {
		return root;
	}

	public void register(String path, SceneNode node) {
		SceneNode old = nodesByPath.putIfAbsent(requireNonNull(path), requireNonNull(node));
		if (old != null) {
			throw new IllegalArgumentException("Path already registered: \"" + path + "\"");
		}
	}

	@Override
	public @Nullable SceneNode find(String path) {
		return nodesByPath.get(path);
	}

	public Set<String> paths() {
		return unmodifiableSet(nodesByPath.keySet());
	}

	@Override
	public String toString() {
		return "NodeDirectory(" + root.name() + ", " + nodesByPath.size() + " paths)";
	}
}
