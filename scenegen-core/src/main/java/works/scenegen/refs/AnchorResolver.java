package works.scenegen.refs;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import works.scenegen.graph.GraphNode;

/**
 * Knows which nodes are anchor boundaries: containers built elsewhere
 * whose descendants are found by path instead of being constructed.
 */
public final class AnchorResolver {
	private final Set<GraphNode> boundaries = Collections.newSetFromMap(new IdentityHashMap<>());

	public AnchorResolver(Collection<? extends GraphNode> boundaries) {
		this.boundaries.addAll(boundaries);
	}

	public static AnchorResolver none() {
		return new AnchorResolver(Set.of());
	}

	public boolean isBoundary(GraphNode node) {
		return boundaries.contains(node);
	}

	/**
	 * @return the names of the nodes from just below the nearest enclosing boundary
	 * down to {@code node}, joined with {@code /}; or null if {@code node}
	 * has no boundary among its strict ancestors
	 */
	public @Nullable String pathOf(GraphNode node) {
		if (boundaries.isEmpty() || isBoundary(node)) {
			return null;
		}
		Deque<String> names = new ArrayDeque<>();
		for (GraphNode current = node; current != null; current = current.parent()) {
			names.addFirst(current.name());
			GraphNode parent = current.parent();
			if (parent != null && isBoundary(parent)) {
				return String.join("/", names);
			}
		}
		return null;
	}
}
